package com.fractionax.propertyEngine.orchestrator.service;

import com.fractionax.propertyEngine.orchestrator.model.CanonicalProperty;
import com.fractionax.propertyEngine.orchestrator.model.FieldAlternate;
import com.fractionax.propertyEngine.provider.ProviderId;
import com.fractionax.propertyEngine.provider.model.ListingData;
import com.fractionax.propertyEngine.provider.model.ParcelMatch;
import com.fractionax.propertyEngine.provider.model.StructureData;
import com.fractionax.propertyEngine.provider.model.ValuationData;
import com.fractionax.propertyEngine.query.model.StreetAddress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PropertyMergeServiceTest {

    private final PropertyMergeService mergeService = new PropertyMergeService();

    private static final ParcelMatch PARCEL = ParcelMatch.builder()
            .parcelId("1234567890")
            .address(StreetAddress.builder()
                    .line1("1600 AMPHITHEATRE PKWY").city("MOUNTAIN VIEW").state("CA").postalCode("94043").build())
            .latitude(37.4220)
            .longitude(-122.0841)
            .build();

    private static final StructureData CORELOGIC_STRUCTURE = StructureData.builder()
            .propertyType("house").yearBuilt(1998).squareFeet(2450).bedrooms(4).bathrooms(2.5).build();

    private static final ListingData LISTING = ListingData.builder()
            .listingId("19520814")
            .addressText("1600 Amphitheatre Pkwy, Mountain View, CA 94043")
            .address(StreetAddress.builder()
                    .line1("1600 Amphitheatre Pkwy").city("Mountain View").state("CA").postalCode("94043").build())
            .latitude(37.4219)
            .longitude(-122.0840)
            .price(1_925_000L)
            .status("FOR_SALE")
            .structure(StructureData.builder().propertyType("house").squareFeet(2500).bedrooms(4).bathrooms(3.0).build())
            .images(List.of("https://photos.example.com/1.jpg"))
            .build();

    @Test
    @DisplayName("property data wins structure conflicts and the listing value is kept as an alternate")
    void conflictKeepsAlternate() {
        CanonicalProperty merged = mergeService.merge(PARCEL, CORELOGIC_STRUCTURE,
                ValuationData.builder().currentValue(1_850_000L).assessedValue(1_420_000L).build(), LISTING);

        assertEquals(2450, merged.getStructure().getSquareFeet());
        assertEquals(2.5, merged.getStructure().getBathrooms());
        assertEquals(4, merged.getStructure().getBedrooms());
        assertEquals(1998, merged.getStructure().getYearBuilt());
        assertEquals(List.of(
                new FieldAlternate("structure.squareFeet", ProviderId.ZILLOW, 2500),
                new FieldAlternate("structure.bathrooms", ProviderId.ZILLOW, 3.0)), merged.getAlternates());
        assertEquals(Set.of(ProviderId.CORELOGIC, ProviderId.ZILLOW), merged.getSources());
    }

    @Test
    @DisplayName("address and coordinates come from the parcel, listing fields from the listing")
    void sourcePrecedence() {
        CanonicalProperty merged = mergeService.merge(PARCEL, CORELOGIC_STRUCTURE,
                ValuationData.builder().currentValue(1_850_000L).build(), LISTING);

        assertEquals("1234567890", merged.getParcelId());
        assertEquals("1600 AMPHITHEATRE PKWY", merged.getAddress().getStreet());
        assertEquals("1600 AMPHITHEATRE PKWY, MOUNTAIN VIEW, CA 94043", merged.getAddress().getOneLine());
        assertEquals(37.4220, merged.getCoordinates().getLatitude());
        assertEquals(1_850_000L, merged.getValuation().getCurrentValue());
        assertEquals("19520814", merged.getListing().getListingId());
        assertEquals(1_925_000L, merged.getListing().getPriceMax());
        assertEquals(List.of("https://photos.example.com/1.jpg"), merged.getListing().getImages());
    }

    @Test
    @DisplayName("a listing alone fills address, coordinates and structure")
    void listingOnly() {
        CanonicalProperty merged = mergeService.merge(null, null, null, LISTING);

        assertNull(merged.getParcelId());
        assertEquals("1600 Amphitheatre Pkwy", merged.getAddress().getStreet());
        assertEquals(37.4219, merged.getCoordinates().getLatitude());
        assertEquals(2500, merged.getStructure().getSquareFeet());
        assertTrue(merged.getAlternates().isEmpty());
        assertNull(merged.getValuation().getCurrentValue());
        assertEquals(Set.of(ProviderId.ZILLOW), merged.getSources());
    }

    @Test
    @DisplayName("nested objects are present even when nothing was found")
    void emptyMerge() {
        CanonicalProperty merged = mergeService.merge(null, null, null, null);

        assertNotNull(merged.getAddress());
        assertNotNull(merged.getCoordinates());
        assertFalse(merged.getCoordinates().isPresent());
        assertNotNull(merged.getStructure());
        assertNotNull(merged.getValuation());
        assertTrue(merged.getListing().getImages().isEmpty());
        assertTrue(merged.getSources().isEmpty());
    }

    @Test
    @DisplayName("a listing address that could not be parsed keeps the provider's text")
    void unparsedListingAddress() {
        ListingData listing = LISTING.toBuilder().address(null).addressText("Lot 7, Ranch Road").build();

        CanonicalProperty merged = mergeService.merge(null, null, null, listing);

        assertEquals("Lot 7, Ranch Road", merged.getAddress().getOneLine());
        assertNull(merged.getAddress().getStreet());
    }
}

package com.fractionax.propertyEngine.gateway.service;

import com.fractionax.propertyEngine.gateway.dto.LegacySearchResponse;
import com.fractionax.propertyEngine.orchestrator.model.CanonicalProperty;
import com.fractionax.propertyEngine.orchestrator.model.Coordinates;
import com.fractionax.propertyEngine.orchestrator.model.PropertyAddress;
import com.fractionax.propertyEngine.orchestrator.model.PropertyListing;
import com.fractionax.propertyEngine.orchestrator.model.PropertyResolution;
import com.fractionax.propertyEngine.orchestrator.model.PropertyStructure;
import com.fractionax.propertyEngine.orchestrator.model.PropertyValuation;
import com.fractionax.propertyEngine.orchestrator.model.ResolutionError;
import com.fractionax.propertyEngine.orchestrator.model.ResolutionErrorCode;
import com.fractionax.propertyEngine.orchestrator.model.ResolutionMetadata;
import com.fractionax.propertyEngine.provider.ProviderId;
import com.fractionax.propertyEngine.query.model.SearchType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LegacyResponseAdapterTest {

    private final LegacyResponseAdapter adapter = new LegacyResponseAdapter();

    @Test
    @DisplayName("merged listings carry listing fields, structure and a 'merged' data source")
    void mergedListing() {
        CanonicalProperty property = CanonicalProperty.builder()
                .parcelId("555")
                .address(PropertyAddress.builder().oneLine("123 Main St, Houston, TX 77002").street("123 Main St")
                        .city("Houston").state("TX").postalCode("77002").build())
                .coordinates(new Coordinates(29.7604, -95.3698))
                .structure(PropertyStructure.builder().bedrooms(3).bathrooms(2.0).squareFeet(1650).build())
                .listing(PropertyListing.builder().listingId("27941236").priceMax(285_000L)
                        .images(new ArrayList<>(List.of("https://photos.example.com/a.jpg", "https://photos.example.com/b.jpg")))
                        .build())
                .sources(EnumSet.of(ProviderId.CORELOGIC, ProviderId.ZILLOW))
                .build();
        PropertyResolution resolution = PropertyResolution.builder()
                .results(List.of(property))
                .metadata(ResolutionMetadata.builder().searchType(SearchType.GENERAL).fromCache(true).build())
                .build();

        LegacySearchResponse response = adapter.toLegacy("homes in Houston", resolution);

        assertEquals(200, response.getHttpStatus());
        assertTrue(response.getFromCache());
        assertEquals("general", response.getMetadata().getSearchType());
        assertEquals(1, response.getMetadata().getTotalFound());
        LegacySearchResponse.Listing listing = response.getListings().get(0);
        assertEquals("27941236", listing.getId());
        assertEquals("27941236", listing.getZpid());
        assertEquals(285_000L, listing.getPrice());
        assertEquals(3, listing.getBeds());
        assertEquals("77002", listing.getAddress().getZip());
        assertEquals(29.7604, listing.getLocation().getLatitude());
        assertEquals("https://photos.example.com/a.jpg", listing.getImgSrc());
        assertEquals(2, listing.getCarouselPhotos().size());
        assertEquals("merged", listing.getDataSource());
    }

    @Test
    @DisplayName("a property without a listing uses the parcel id and the valuation as price")
    void parcelOnly() {
        CanonicalProperty property = CanonicalProperty.builder()
                .parcelId("1234567890")
                .valuation(new PropertyValuation(1_850_000L, 1_420_000L))
                .sources(EnumSet.of(ProviderId.CORELOGIC))
                .build();

        LegacySearchResponse response = adapter.toLegacy("1600 Amphitheatre Parkway",
                PropertyResolution.builder().results(List.of(property))
                        .metadata(ResolutionMetadata.builder().searchType(SearchType.ADDRESS).build()).build());

        LegacySearchResponse.Listing listing = response.getListings().get(0);
        assertEquals("1234567890", listing.getId());
        assertNull(listing.getZpid());
        assertEquals(1_850_000L, listing.getPrice());
        assertNull(listing.getImgSrc());
        assertEquals("corelogic", listing.getDataSource());
    }

    @Test
    @DisplayName("errors render as title and details only")
    void error() {
        LegacySearchResponse response = adapter.toLegacy("x", PropertyResolution.builder()
                .error(new ResolutionError(ResolutionErrorCode.NOT_FOUND, "no record", ProviderId.CORELOGIC))
                .build());

        assertEquals(404, response.getHttpStatus());
        assertEquals("Property not found", response.getError());
        assertEquals("no record", response.getDetails());
        assertNull(response.getListings());
        assertNull(response.getFromCache());
    }
}

package com.fractionax.propertyEngine.orchestrator.service;

import com.fractionax.propertyEngine.orchestrator.model.CanonicalProperty;
import com.fractionax.propertyEngine.orchestrator.model.DataSourceStatus;
import com.fractionax.propertyEngine.orchestrator.model.EnrichmentResult;
import com.fractionax.propertyEngine.orchestrator.model.ResolutionState;
import com.fractionax.propertyEngine.provider.ListingsProvider;
import com.fractionax.propertyEngine.provider.PropertyDataProvider;
import com.fractionax.propertyEngine.provider.ProviderId;
import com.fractionax.propertyEngine.provider.ProviderRegistry;
import com.fractionax.propertyEngine.provider.model.ListingData;
import com.fractionax.propertyEngine.provider.model.ListingSearchResult;
import com.fractionax.propertyEngine.provider.model.ParcelMatch;
import com.fractionax.propertyEngine.provider.model.StructureData;
import com.fractionax.propertyEngine.provider.model.ValuationData;
import com.fractionax.propertyEngine.query.model.NormalizedQuery;
import com.fractionax.propertyEngine.query.model.SearchFilters;
import com.fractionax.propertyEngine.query.model.StreetAddress;
import com.fractionax.propertyEngine.query.util.AddressParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Address resolution - resolves an exact address to one parcel.
 *
 * Steps:
 * LOOKUP (address, spatial fallback when coordinates were given) -> STRUCTURE + VALUATION + LISTING in parallel
 * -> IMAGES when the listing has none -> MERGE
 *
 * Primary: the parcel lookup and the structure call. Valuation, listing and images are enrichment.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AddressResolutionService {

    private final ProviderRegistry providerRegistry;
    private final ProviderCallCoordinator calls;
    private final PropertyMergeService mergeService;

    /**
     * Resolves the address of the state's query and adds the merged property to the state.
     *
     * @param state Resolution state; results and data sources are updated in place
     * @return The same state
     */
    public ResolutionState resolve(ResolutionState state) {
        String correlationId = state.getCorrelationId();
        NormalizedQuery query = state.getQuery();
        PropertyDataProvider coreLogic = providerRegistry.propertyData(ProviderId.CORELOGIC);
        ListingsProvider zillow = providerRegistry.listings(ProviderId.ZILLOW);

        // Step 1: LOOKUP
        log.debug("Step LOOKUP - correlationId: {}", correlationId);
        Optional<ParcelMatch> parcel = lookupParcel(coreLogic, query, correlationId);
        if (parcel.isEmpty()) {
            log.info("No parcel found for address - correlationId: {}", correlationId);
            state.recordSource(ProviderId.CORELOGIC, DataSourceStatus.NOT_FOUND);
            state.recordSource(ProviderId.ZILLOW, DataSourceStatus.SKIPPED);
            return state;
        }
        String parcelId = parcel.get().getParcelId();
        state.recordSource(ProviderId.CORELOGIC, DataSourceStatus.USED);

        // Step 2: STRUCTURE + VALUATION + LISTING
        log.debug("Step DETAILS - correlationId: {}, parcelId: {}", correlationId, parcelId);
        CompletableFuture<StructureData> structureFuture =
                calls.primaryAsync(ProviderId.CORELOGIC, "getStructure", () -> coreLogic.getStructure(parcelId));
        CompletableFuture<EnrichmentResult<ValuationData>> valuationFuture =
                calls.enrichAsync(ProviderId.CORELOGIC, "getValuation", () -> coreLogic.getValuation(parcelId));
        StreetAddress listingAddress = parcel.get().getAddress() != null ? parcel.get().getAddress() : query.getAddress();
        CompletableFuture<EnrichmentResult<ListingData>> listingFuture =
                calls.enrichAsync(ProviderId.ZILLOW, "searchByLocation", () -> findListing(zillow, listingAddress));

        StructureData structure;
        try {
            structure = calls.join(structureFuture);
        } finally {
            // Enrichment futures never fail; wait for them even when the structure call did
            valuationFuture.join();
            listingFuture.join();
        }
        EnrichmentResult<ValuationData> valuation = valuationFuture.join();
        EnrichmentResult<ListingData> listing = listingFuture.join();
        if (valuation.isFailed()) {
            state.recordSource(ProviderId.CORELOGIC, DataSourceStatus.FAILED);
        }
        state.recordSource(ProviderId.ZILLOW, listing.toDataSourceStatus());

        // Step 3: IMAGES
        ListingData listingData = listing.getValue();
        if (listingData != null && (listingData.getImages() == null || listingData.getImages().isEmpty())) {
            String listingId = listingData.getListingId();
            log.debug("Step IMAGES - correlationId: {}, listingId: {}", correlationId, listingId);
            EnrichmentResult<List<String>> images =
                    calls.enrich(ProviderId.ZILLOW, "getImages", () -> zillow.getImages(listingId));
            if (images.isFailed()) {
                state.recordSource(ProviderId.ZILLOW, DataSourceStatus.FAILED);
            } else if (images.isPresent()) {
                listingData = listingData.toBuilder().images(images.getValue()).build();
            }
        }

        // Step 4: MERGE
        CanonicalProperty merged = mergeService.merge(parcel.get(), structure, valuation.getValue(), listingData);
        state.getResults().add(merged);
        log.info("Address resolved - correlationId: {}, parcelId: {}, sources: {}",
                correlationId, parcelId, merged.getSources());
        return state;
    }

    private Optional<ParcelMatch> lookupParcel(PropertyDataProvider coreLogic, NormalizedQuery query, String correlationId) {
        Optional<ParcelMatch> byAddress = calls.primary(ProviderId.CORELOGIC, "lookupByAddress",
                () -> coreLogic.lookupByAddress(query.getAddress()));
        if (byAddress.isPresent() || !query.hasCoordinates()) {
            return byAddress;
        }

        log.info("Address lookup found nothing, falling back to spatial lookup - correlationId: {}", correlationId);
        List<ParcelMatch> nearby = calls.primary(ProviderId.CORELOGIC, "lookupBySpatial",
                () -> coreLogic.lookupBySpatial(query.getLatitude(), query.getLongitude()));
        return nearby.stream().filter(Objects::nonNull).findFirst();
    }

    /**
     * Searches listings restricted to the exact address and picks the one on the same street number.
     */
    private ListingData findListing(ListingsProvider zillow, StreetAddress address) {
        String oneLine = address.oneLine();
        ListingSearchResult result = zillow.searchByLocation(oneLine, SearchFilters.builder().location(oneLine).build());
        if (result == null || result.getListings() == null) {
            return null;
        }
        String streetNumber = AddressParser.streetNumber(address.getLine1());
        String streetName = AddressParser.normalizedStreetName(address.getLine1());
        return result.getListings().stream()
                .filter(listing -> listing.getAddress() != null)
                .filter(listing -> Objects.equals(streetNumber, AddressParser.streetNumber(listing.getAddress().getLine1())))
                .filter(listing -> Objects.equals(streetName, AddressParser.normalizedStreetName(listing.getAddress().getLine1())))
                .findFirst()
                .orElse(null);
    }
}

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
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * General search - resolves a free-text listing search.
 *
 * Steps:
 * SEARCH (listings provider, filters it supports as query parameters) -> POST_FILTER (the rest)
 * -> ENRICH (top N listings: parcel, structure, valuation; bounded concurrency) -> MERGE
 *
 * Primary: the listing search. Enrichment is best-effort per listing.
 */
@Slf4j
@Service
public class GeneralSearchService {

    private final ProviderRegistry providerRegistry;
    private final ProviderCallCoordinator calls;
    private final PropertyMergeService mergeService;
    private final int enrichmentLimit;
    private final int enrichmentConcurrency;

    public GeneralSearchService(ProviderRegistry providerRegistry,
                                ProviderCallCoordinator calls,
                                PropertyMergeService mergeService,
                                @Value("${engine.general.enrichment-limit:10}") int enrichmentLimit,
                                @Value("${engine.general.enrichment-concurrency:4}") int enrichmentConcurrency) {
        this.providerRegistry = providerRegistry;
        this.calls = calls;
        this.mergeService = mergeService;
        this.enrichmentLimit = enrichmentLimit;
        this.enrichmentConcurrency = Math.max(1, enrichmentConcurrency);
    }

    /**
     * Runs the listing search of the state's query and adds the merged properties to the state.
     *
     * @param state Resolution state; results and data sources are updated in place
     * @return Filter names the listings provider applied as query parameters
     */
    public Set<String> resolve(ResolutionState state) {
        String correlationId = state.getCorrelationId();
        NormalizedQuery query = state.getQuery();
        SearchFilters filters = query.getFilters() != null ? query.getFilters() : SearchFilters.builder().build();
        ListingsProvider zillow = providerRegistry.listings(ProviderId.ZILLOW);

        // Step 1: SEARCH
        log.debug("Step SEARCH - correlationId: {}, filters: {}", correlationId, filters.active());
        ListingSearchResult result = calls.primary(ProviderId.ZILLOW, "searchByLocation",
                () -> zillow.searchByLocation(query.getText(), filters));
        List<ListingData> listings = result != null && result.getListings() != null ? result.getListings() : List.of();
        Set<String> applied = result != null && result.getAppliedFilters() != null
                ? new LinkedHashSet<>(result.getAppliedFilters())
                : new LinkedHashSet<>(zillow.supportedFilters());
        state.setProviderTotal(result != null ? result.getTotalResultCount() : null);
        state.recordSource(ProviderId.ZILLOW, listings.isEmpty() ? DataSourceStatus.NOT_FOUND : DataSourceStatus.USED);

        // Step 2: POST_FILTER
        List<ListingData> filtered = listings.stream()
                .filter(listing -> matchesPostFilters(listing, filters, applied))
                .toList();
        if (filtered.size() != listings.size()) {
            log.info("Post-filter removed {} of {} listings - correlationId: {}",
                    listings.size() - filtered.size(), listings.size(), correlationId);
        }

        // Step 3: ENRICH
        List<ListingEnrichment> enrichments = enrich(filtered, state);

        // Step 4: MERGE
        for (int i = 0; i < filtered.size(); i++) {
            ListingData listing = filtered.get(i);
            ListingEnrichment enrichment = i < enrichments.size() ? enrichments.get(i) : ListingEnrichment.NONE;
            state.getResults().add(mergeService.merge(enrichment.parcel(), enrichment.structure(),
                    enrichment.valuation(), listing));
        }

        log.info("General search resolved - correlationId: {}, listings: {}, enriched: {}",
                correlationId, filtered.size(), enrichments.stream().filter(e -> e.parcel() != null).count());
        return applied;
    }

    /**
     * Enriches the first {@code enrichmentLimit} listings with property data, at most
     * {@code enrichmentConcurrency} at a time. Results are index-aligned with the listings.
     */
    private List<ListingEnrichment> enrich(List<ListingData> listings, ResolutionState state) {
        List<ListingData> candidates = listings.subList(0, Math.min(enrichmentLimit, listings.size()));
        if (candidates.isEmpty() || candidates.stream().allMatch(listing -> listing.getAddress() == null)) {
            state.recordSource(ProviderId.CORELOGIC, DataSourceStatus.SKIPPED);
            return List.of();
        }

        log.debug("Step ENRICH - correlationId: {}, candidates: {}, concurrency: {}",
                state.getCorrelationId(), candidates.size(), enrichmentConcurrency);
        PropertyDataProvider coreLogic = providerRegistry.propertyData(ProviderId.CORELOGIC);
        Semaphore permits = new Semaphore(enrichmentConcurrency);

        List<CompletableFuture<ListingEnrichment>> futures = new ArrayList<>();
        for (ListingData listing : candidates) {
            futures.add(calls.enrichAsync(ProviderId.CORELOGIC, "enrichListing",
                            bounded(permits, () -> enrichOne(coreLogic, listing)))
                    .thenApply(outcome -> outcome.isPresent() ? outcome.getValue() : ListingEnrichment.failed()));
        }

        List<ListingEnrichment> enrichments = futures.stream().map(CompletableFuture::join).toList();
        enrichments.forEach(enrichment -> state.recordSource(ProviderId.CORELOGIC, enrichment.status()));
        return enrichments;
    }

    private ListingEnrichment enrichOne(PropertyDataProvider coreLogic, ListingData listing) {
        if (listing.getAddress() == null) {
            return ListingEnrichment.NONE;
        }
        EnrichmentResult<Optional<ParcelMatch>> parcel = calls.enrich(ProviderId.CORELOGIC, "lookupByAddress",
                () -> coreLogic.lookupByAddress(listing.getAddress()));
        if (parcel.isFailed()) {
            return ListingEnrichment.failed();
        }
        if (parcel.getValue() == null || parcel.getValue().isEmpty()) {
            return new ListingEnrichment(null, null, null, DataSourceStatus.NOT_FOUND);
        }

        ParcelMatch match = parcel.getValue().get();
        EnrichmentResult<StructureData> structure = calls.enrich(ProviderId.CORELOGIC, "getStructure",
                () -> coreLogic.getStructure(match.getParcelId()));
        EnrichmentResult<ValuationData> valuation = calls.enrich(ProviderId.CORELOGIC, "getValuation",
                () -> coreLogic.getValuation(match.getParcelId()));
        DataSourceStatus status = structure.isFailed() || valuation.isFailed()
                ? DataSourceStatus.FAILED
                : DataSourceStatus.USED;
        return new ListingEnrichment(match, structure.getValue(), valuation.getValue(), status);
    }

    private static <T> Supplier<T> bounded(Semaphore permits, Supplier<T> work) {
        return () -> {
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted waiting for an enrichment slot", e);
            }
            try {
                return work.get();
            } finally {
                permits.release();
            }
        };
    }

    static boolean matchesPostFilters(ListingData listing, SearchFilters filters, Set<String> applied) {
        if (filters.getMinPrice() != null && !applied.contains(SearchFilters.MIN_PRICE)
                && (listing.getPrice() == null || listing.getPrice() < filters.getMinPrice())) {
            return false;
        }
        if (filters.getMaxPrice() != null && !applied.contains(SearchFilters.MAX_PRICE)
                && (listing.getPrice() == null || listing.getPrice() > filters.getMaxPrice())) {
            return false;
        }
        Integer bedrooms = listing.getStructure() != null ? listing.getStructure().getBedrooms() : null;
        if (filters.getMinBeds() != null && !applied.contains(SearchFilters.MIN_BEDS)
                && (bedrooms == null || bedrooms < filters.getMinBeds())) {
            return false;
        }
        if (filters.getStatus() != null && !applied.contains(SearchFilters.STATUS)
                && !filters.getStatus().equalsIgnoreCase(String.valueOf(listing.getStatus()))) {
            return false;
        }
        String propertyType = listing.getStructure() != null ? listing.getStructure().getPropertyType() : null;
        return filters.getPropertyType() == null || applied.contains(SearchFilters.PROPERTY_TYPE)
                || filters.getPropertyType().equalsIgnoreCase(String.valueOf(propertyType));
    }

    private record ListingEnrichment(ParcelMatch parcel, StructureData structure, ValuationData valuation,
                                     DataSourceStatus status) {

        static final ListingEnrichment NONE = new ListingEnrichment(null, null, null, DataSourceStatus.SKIPPED);

        static ListingEnrichment failed() {
            return new ListingEnrichment(null, null, null, DataSourceStatus.FAILED);
        }
    }
}

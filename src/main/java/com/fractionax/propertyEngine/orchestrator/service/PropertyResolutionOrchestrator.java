package com.fractionax.propertyEngine.orchestrator.service;

import com.fractionax.propertyEngine.cache.CacheEntry;
import com.fractionax.propertyEngine.cache.ResponseCache;
import com.fractionax.propertyEngine.gateway.model.RequestContext;
import com.fractionax.propertyEngine.orchestrator.exception.ResolutionException;
import com.fractionax.propertyEngine.orchestrator.model.CanonicalProperty;
import com.fractionax.propertyEngine.orchestrator.model.DataSourceStatus;
import com.fractionax.propertyEngine.orchestrator.model.EnrichmentResult;
import com.fractionax.propertyEngine.orchestrator.model.PropertyResolution;
import com.fractionax.propertyEngine.orchestrator.model.ResolutionError;
import com.fractionax.propertyEngine.orchestrator.model.ResolutionErrorCode;
import com.fractionax.propertyEngine.orchestrator.model.ResolutionMetadata;
import com.fractionax.propertyEngine.orchestrator.model.ResolutionState;
import com.fractionax.propertyEngine.provider.PropertyDataProvider;
import com.fractionax.propertyEngine.provider.ProviderId;
import com.fractionax.propertyEngine.provider.ProviderRegistry;
import com.fractionax.propertyEngine.provider.model.ParcelMatch;
import com.fractionax.propertyEngine.provider.model.StructureData;
import com.fractionax.propertyEngine.provider.model.ValuationData;
import com.fractionax.propertyEngine.query.model.NormalizedQuery;
import com.fractionax.propertyEngine.query.model.PropertyQuery;
import com.fractionax.propertyEngine.query.model.SearchType;
import com.fractionax.propertyEngine.query.service.QueryClassifier;
import com.fractionax.propertyEngine.query.service.QueryNormalizer;
import com.fractionax.propertyEngine.query.util.QueryFingerprint;
import com.fractionax.propertyEngine.verification.model.VerificationEnvelope;
import com.fractionax.propertyEngine.verification.service.VerificationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Resolution orchestrator - workflow owner for property queries.
 *
 * Workflow steps:
 * CLASSIFY -> NORMALIZE -> CACHE_CHECK -> (hit: RESPOND)
 * -> DISPATCH (ADDRESS | GENERAL) -> VERIFY -> CACHE_STORE -> RESPOND
 *
 * Never throws: failures come back as a {@link PropertyResolution} carrying an error and
 * whatever was resolved before the failure.
 */
@Slf4j
@Service
public class PropertyResolutionOrchestrator {

    private final QueryClassifier queryClassifier;
    private final QueryNormalizer queryNormalizer;
    private final ResponseCache responseCache;
    private final AddressResolutionService addressResolutionService;
    private final GeneralSearchService generalSearchService;
    private final PropertyMergeService mergeService;
    private final VerificationService verificationService;
    private final ProviderRegistry providerRegistry;
    private final ProviderCallCoordinator calls;
    private final Clock clock;
    private final Duration generalTtl;
    private final Duration addressTtl;

    public PropertyResolutionOrchestrator(QueryClassifier queryClassifier,
                                          QueryNormalizer queryNormalizer,
                                          ResponseCache responseCache,
                                          AddressResolutionService addressResolutionService,
                                          GeneralSearchService generalSearchService,
                                          PropertyMergeService mergeService,
                                          VerificationService verificationService,
                                          ProviderRegistry providerRegistry,
                                          ProviderCallCoordinator calls,
                                          Clock clock,
                                          @Value("${engine.cache.general-ttl:15m}") Duration generalTtl,
                                          @Value("${engine.cache.address-ttl:1h}") Duration addressTtl) {
        this.queryClassifier = queryClassifier;
        this.queryNormalizer = queryNormalizer;
        this.responseCache = responseCache;
        this.addressResolutionService = addressResolutionService;
        this.generalSearchService = generalSearchService;
        this.mergeService = mergeService;
        this.verificationService = verificationService;
        this.providerRegistry = providerRegistry;
        this.calls = calls;
        this.clock = clock;
        this.generalTtl = generalTtl;
        this.addressTtl = addressTtl;
    }

    /**
     * Resolves a property query.
     *
     * @param query Inbound query (free text or structured address)
     * @param requestContext Request context with correlationId
     * @return Results with verification and metadata, or an error
     */
    public PropertyResolution resolve(PropertyQuery query, RequestContext requestContext) {
        String correlationId = requestContext.getCorrelationId();

        if (query == null || query.isEmpty()) {
            log.warn("Empty query rejected - correlationId: {}", correlationId);
            return failure(new ResolutionError(ResolutionErrorCode.INVALID_QUERY,
                    "Provide a search query or an address", null), null);
        }

        // Step 1: CLASSIFY
        SearchType searchType = queryClassifier.classify(query);

        // Step 2: NORMALIZE
        NormalizedQuery normalized;
        try {
            normalized = queryNormalizer.normalize(query, searchType);
        } catch (IllegalArgumentException e) {
            log.warn("Query could not be normalized - correlationId: {}, error: {}", correlationId, e.getMessage());
            return failure(new ResolutionError(ResolutionErrorCode.INVALID_QUERY, e.getMessage(), null),
                    ResolutionMetadata.builder().searchType(searchType).build());
        }
        String fingerprint = QueryFingerprint.of(normalized);
        log.info("Resolving query - correlationId: {}, searchType: {}, fingerprint: {}", correlationId, searchType, fingerprint);

        // Step 3: CACHE_CHECK
        Optional<PropertyResolution> cached = fromCache(fingerprint);
        if (cached.isPresent()) {
            log.info("Cache hit - correlationId: {}, fingerprint: {}", correlationId, fingerprint);
            return cached.get();
        }

        return responseCache.resolveOnce(fingerprint, () -> fromCache(fingerprint)
                .orElseGet(() -> resolveFresh(normalized, fingerprint, requestContext)));
    }

    /**
     * Resolves property details (structure + valuation) of a known parcel.
     *
     * @param parcelId CoreLogic parcel id (CLIP)
     * @param requestContext Request context with correlationId
     * @return One property, or an error (NOT_FOUND for an unknown parcel)
     */
    public PropertyResolution resolveParcel(String parcelId, RequestContext requestContext) {
        String correlationId = requestContext.getCorrelationId();
        if (parcelId == null || parcelId.isBlank()) {
            return failure(new ResolutionError(ResolutionErrorCode.INVALID_QUERY, "Parcel id is required", null), null);
        }

        String fingerprint = QueryFingerprint.ofParcel(parcelId);
        Optional<PropertyResolution> cached = fromCache(fingerprint);
        if (cached.isPresent()) {
            log.info("Cache hit - correlationId: {}, parcelId: {}", correlationId, parcelId);
            return cached.get();
        }

        return responseCache.resolveOnce(fingerprint, () -> fromCache(fingerprint)
                .orElseGet(() -> resolveParcelFresh(parcelId.trim(), fingerprint, correlationId)));
    }

    private PropertyResolution resolveFresh(NormalizedQuery query, String fingerprint, RequestContext requestContext) {
        String correlationId = requestContext.getCorrelationId();
        ResolutionState state = ResolutionState.builder()
                .requestContext(requestContext)
                .query(query)
                .fingerprint(fingerprint)
                .build();

        try {
            // Step 4: DISPATCH
            Set<String> providerFilters = Set.of();
            if (query.getSearchType() == SearchType.ADDRESS) {
                addressResolutionService.resolve(state);
            } else {
                providerFilters = generalSearchService.resolve(state);
            }

            // Step 5: VERIFY
            for (CanonicalProperty property : state.getResults()) {
                property.setVerification(verificationService.verify(query, property, providerFilters));
            }
            VerificationEnvelope verification = verificationService.summarize(query, state.getResults(), providerFilters);

            PropertyResolution resolution = PropertyResolution.builder()
                    .results(state.getResults())
                    .verification(verification)
                    .metadata(metadata(state, query.getSearchType()))
                    .build();

            // Step 6: CACHE_STORE
            if (query.getSearchType() == SearchType.ADDRESS && state.getResults().isEmpty()) {
                log.debug("Empty address result not cached - correlationId: {}", correlationId);
            } else {
                store(fingerprint, resolution, query.getSearchType() == SearchType.ADDRESS ? addressTtl : generalTtl);
            }

            log.info("Query resolved - correlationId: {}, results: {}, dataSources: {}",
                    correlationId, state.getResults().size(), state.getDataSources());
            return resolution;

        } catch (ResolutionException e) {
            log.error("Resolution failed - correlationId: {}, code: {}, provider: {}, error: {}",
                    correlationId, e.getCode(), e.getProviderId(), e.getMessage());
            if (e.getProviderId() != null) {
                state.recordSource(e.getProviderId(), DataSourceStatus.FAILED);
            }
            return partialFailure(e.toError(), state, query.getSearchType());
        } catch (RuntimeException e) {
            log.error("Unexpected error in resolution - correlationId: {}", correlationId, e);
            return partialFailure(new ResolutionError(ResolutionErrorCode.INTERNAL_ERROR,
                    "Unexpected error while resolving the query", null), state, query.getSearchType());
        }
    }

    private PropertyResolution resolveParcelFresh(String parcelId, String fingerprint, String correlationId) {
        PropertyDataProvider coreLogic = providerRegistry.propertyData(ProviderId.CORELOGIC);
        LinkedHashMap<String, DataSourceStatus> dataSources = new LinkedHashMap<>();
        dataSources.put(ProviderId.CORELOGIC.id(), DataSourceStatus.USED);
        dataSources.put(ProviderId.ZILLOW.id(), DataSourceStatus.SKIPPED);

        try {
            log.debug("Step DETAILS - correlationId: {}, parcelId: {}", correlationId, parcelId);
            CompletableFuture<StructureData> structureFuture =
                    calls.primaryAsync(ProviderId.CORELOGIC, "getStructure", () -> coreLogic.getStructure(parcelId));
            CompletableFuture<EnrichmentResult<ValuationData>> valuationFuture =
                    calls.enrichAsync(ProviderId.CORELOGIC, "getValuation", () -> coreLogic.getValuation(parcelId));

            StructureData structure;
            try {
                structure = calls.join(structureFuture);
            } finally {
                valuationFuture.join();
            }
            EnrichmentResult<ValuationData> valuation = valuationFuture.join();
            if (valuation.isFailed()) {
                dataSources.put(ProviderId.CORELOGIC.id(), DataSourceStatus.FAILED);
            }

            CanonicalProperty property = mergeService.merge(
                    ParcelMatch.builder().parcelId(parcelId).build(), structure, valuation.getValue(), null);
            VerificationEnvelope verification = VerificationEnvelope.builder().valid(true).matchedField("parcelId").build();
            property.setVerification(verification);

            PropertyResolution resolution = PropertyResolution.builder()
                    .results(new ArrayList<>(List.of(property)))
                    .verification(verification)
                    .metadata(ResolutionMetadata.builder()
                            .searchType(SearchType.ADDRESS)
                            .totalFound(1)
                            .fromCache(false)
                            .dataSources(dataSources)
                            .fingerprint(fingerprint)
                            .resolvedAt(clock.instant())
                            .build())
                    .build();
            store(fingerprint, resolution, addressTtl);
            log.info("Parcel resolved - correlationId: {}, parcelId: {}", correlationId, parcelId);
            return resolution;

        } catch (ResolutionException e) {
            log.error("Parcel resolution failed - correlationId: {}, parcelId: {}, code: {}",
                    correlationId, parcelId, e.getCode());
            dataSources.put(ProviderId.CORELOGIC.id(),
                    e.getCode() == ResolutionErrorCode.NOT_FOUND ? DataSourceStatus.NOT_FOUND : DataSourceStatus.FAILED);
            return failure(e.toError(), ResolutionMetadata.builder()
                    .searchType(SearchType.ADDRESS)
                    .dataSources(dataSources)
                    .fingerprint(fingerprint)
                    .resolvedAt(clock.instant())
                    .build());
        }
    }

    private Optional<PropertyResolution> fromCache(String fingerprint) {
        return responseCache.get(fingerprint).map(entry -> PropertyResolution.builder()
                .results(entry.getResults())
                .verification(entry.getVerification())
                .metadata(entry.getMetadata().toBuilder()
                        .fromCache(true)
                        .dataSources(new LinkedHashMap<>(entry.getMetadata().getDataSources()))
                        .build())
                .build());
    }

    private void store(String fingerprint, PropertyResolution resolution, Duration ttl) {
        responseCache.put(fingerprint, CacheEntry.builder()
                .fingerprint(fingerprint)
                .results(List.copyOf(resolution.getResults()))
                .verification(resolution.getVerification())
                .metadata(resolution.getMetadata())
                .createdAt(clock.instant())
                .ttl(ttl)
                .build());
    }

    private ResolutionMetadata metadata(ResolutionState state, SearchType searchType) {
        for (ProviderId providerId : ProviderId.values()) {
            state.recordSource(providerId, DataSourceStatus.SKIPPED);
        }
        return ResolutionMetadata.builder()
                .searchType(searchType)
                .totalFound(state.getResults().size())
                .fromCache(false)
                .dataSources(new LinkedHashMap<>(state.getDataSources()))
                .fingerprint(state.getFingerprint())
                .resolvedAt(clock.instant())
                .build();
    }

    private PropertyResolution partialFailure(ResolutionError error, ResolutionState state, SearchType searchType) {
        PropertyResolution resolution = failure(error, metadata(state, searchType));
        resolution.setResults(state.getResults());
        return resolution;
    }

    private PropertyResolution failure(ResolutionError error, ResolutionMetadata metadata) {
        return PropertyResolution.builder()
                .verification(VerificationEnvelope.builder().valid(false).reason(error.message() != null ? error.message() : error.code().name()).build())
                .metadata(metadata)
                .error(error)
                .build();
    }
}

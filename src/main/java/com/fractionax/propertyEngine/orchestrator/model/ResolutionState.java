package com.fractionax.propertyEngine.orchestrator.model;

import com.fractionax.propertyEngine.gateway.model.RequestContext;
import com.fractionax.propertyEngine.provider.ProviderId;
import com.fractionax.propertyEngine.query.model.NormalizedQuery;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolution state - carries one request through the resolution workflow.
 *
 * Owned by the request thread; enrichment tasks return values instead of writing here.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResolutionState {

    private RequestContext requestContext;

    private NormalizedQuery query;

    private String fingerprint;

    /**
     * Merged results, in provider order.
     */
    @Builder.Default
    private List<CanonicalProperty> results = new ArrayList<>();

    /**
     * Total match count reported by the listings provider, if any.
     */
    private Integer providerTotal;

    @Builder.Default
    private Map<String, DataSourceStatus> dataSources = new LinkedHashMap<>();

    /**
     * Records a provider outcome. FAILED is sticky, USED beats NOT_FOUND and SKIPPED.
     */
    public void recordSource(ProviderId providerId, DataSourceStatus status) {
        dataSources.merge(providerId.id(), status, ResolutionState::stronger);
    }

    public String getCorrelationId() {
        return requestContext != null ? requestContext.getCorrelationId() : null;
    }

    private static DataSourceStatus stronger(DataSourceStatus current, DataSourceStatus next) {
        return rank(next) > rank(current) ? next : current;
    }

    private static int rank(DataSourceStatus status) {
        return switch (status) {
            case SKIPPED -> 0;
            case NOT_FOUND -> 1;
            case USED -> 2;
            case FAILED -> 3;
        };
    }
}

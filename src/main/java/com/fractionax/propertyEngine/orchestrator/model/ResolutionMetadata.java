package com.fractionax.propertyEngine.orchestrator.model;

import com.fractionax.propertyEngine.query.model.SearchType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response metadata of a resolution.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ResolutionMetadata {

    private SearchType searchType;

    /**
     * Number of merged results returned.
     */
    private int totalFound;

    private boolean fromCache;

    /**
     * Provider id ("corelogic", "zillow") to what happened to it.
     */
    @Builder.Default
    private Map<String, DataSourceStatus> dataSources = new LinkedHashMap<>();

    private String fingerprint;

    private Instant resolvedAt;
}

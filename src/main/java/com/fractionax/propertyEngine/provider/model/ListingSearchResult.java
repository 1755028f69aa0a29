package com.fractionax.propertyEngine.provider.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Result page of a listings search.
 */
@Value
@Builder
public class ListingSearchResult {

    List<ListingData> listings;

    /**
     * Total match count reported by the provider (may exceed the page size).
     */
    Integer totalResultCount;

    /**
     * Filter names that were sent to the provider as query parameters.
     */
    Set<String> appliedFilters;
}

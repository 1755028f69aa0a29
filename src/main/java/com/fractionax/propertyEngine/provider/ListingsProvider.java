package com.fractionax.propertyEngine.provider;

import com.fractionax.propertyEngine.provider.model.ListingSearchResult;
import com.fractionax.propertyEngine.query.model.SearchFilters;

import java.util.List;
import java.util.Set;

/**
 * Capability set of a listings-search provider.
 */
public interface ListingsProvider extends PropertyProvider {

    /**
     * Searches listings around a location.
     *
     * @param text Location text or exact one-line address
     * @param filters Filters to apply; the ones in {@link #supportedFilters()} go to the provider
     * @return Listings as returned by the provider, before in-process filtering
     */
    ListingSearchResult searchByLocation(String text, SearchFilters filters);

    /**
     * Fetches the photo URLs of a listing.
     */
    List<String> getImages(String listingId);

    /**
     * Names of the {@link SearchFilters} fields the provider applies as query parameters.
     */
    Set<String> supportedFilters();
}

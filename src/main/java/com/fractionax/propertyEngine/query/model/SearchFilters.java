package com.fractionax.propertyEngine.query.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Listing-search filters parsed from a general query.
 */
@Value
@Builder(toBuilder = true)
public class SearchFilters {

    public static final String LOCATION = "location";
    public static final String MIN_PRICE = "minPrice";
    public static final String MAX_PRICE = "maxPrice";
    public static final String STATUS = "status";
    public static final String MIN_BEDS = "minBeds";
    public static final String PROPERTY_TYPE = "propertyType";

    /**
     * Location text, e.g. "Houston, TX".
     */
    String location;

    Long minPrice;

    Long maxPrice;

    /**
     * Listing status, e.g. "ForSale", "ForRent", "RecentlySold".
     */
    String status;

    Integer minBeds;

    /**
     * Lowercase property type, e.g. "house", "condo", "townhouse".
     */
    String propertyType;

    /**
     * Returns the filters that carry a value, keyed by filter name, in declaration order.
     */
    public Map<String, Object> active() {
        Map<String, Object> active = new LinkedHashMap<>();
        putIfPresent(active, LOCATION, location);
        putIfPresent(active, MIN_PRICE, minPrice);
        putIfPresent(active, MAX_PRICE, maxPrice);
        putIfPresent(active, STATUS, status);
        putIfPresent(active, MIN_BEDS, minBeds);
        putIfPresent(active, PROPERTY_TYPE, propertyType);
        return active;
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null && !(value instanceof String s && s.isBlank())) {
            target.put(key, value);
        }
    }
}

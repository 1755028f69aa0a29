package com.fractionax.propertyEngine.query.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.TreeMap;

/**
 * A classified query with its fields normalized for provider calls and fingerprinting.
 */
@Value
@Builder
public class NormalizedQuery {

    SearchType searchType;

    /**
     * Trimmed, whitespace-collapsed free text. Null for structured queries.
     */
    String text;

    /**
     * Address components. Set for ADDRESS queries.
     */
    StreetAddress address;

    Double latitude;

    Double longitude;

    /**
     * Listing filters. Set for GENERAL queries.
     */
    SearchFilters filters;

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    /**
     * Returns the fields that identify this query, keyed and sorted by field name, with
     * lowercased values. Two queries that differ only in casing or whitespace yield the
     * same map.
     */
    public Map<String, String> identityFields() {
        Map<String, String> fields = new TreeMap<>();
        fields.put("searchType", searchType.name().toLowerCase());
        if (searchType == SearchType.ADDRESS && address != null) {
            put(fields, "address1", address.getLine1());
            put(fields, "city", address.getCity());
            put(fields, "state", address.getState());
            put(fields, "postalCode", address.getPostalCode());
            if (hasCoordinates()) {
                fields.put("lat", String.format(java.util.Locale.ROOT, "%.6f", latitude));
                fields.put("lng", String.format(java.util.Locale.ROOT, "%.6f", longitude));
            }
        } else {
            put(fields, "text", text);
            if (filters != null) {
                filters.active().forEach((key, value) -> put(fields, "filter." + key, String.valueOf(value)));
            }
        }
        return fields;
    }

    private static void put(Map<String, String> fields, String key, String value) {
        if (value == null) {
            return;
        }
        String normalized = value.trim().replaceAll("\\s+", " ").toLowerCase();
        if (!normalized.isEmpty()) {
            fields.put(key, normalized);
        }
    }
}

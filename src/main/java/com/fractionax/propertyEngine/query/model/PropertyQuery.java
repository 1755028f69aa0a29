package com.fractionax.propertyEngine.query.model;

import lombok.Builder;
import lombok.Value;

/**
 * Inbound property query.
 *
 * Either free text ({@code rawText}) or structured address fields. Immutable once built.
 */
@Value
@Builder(toBuilder = true)
public class PropertyQuery {

    /**
     * Free-text query, e.g. "affordable homes in Houston" or "123 Main St, Houston, TX".
     */
    String rawText;

    String address1;

    String city;

    String state;

    String postalCode;

    /**
     * Optional latitude supplied by the caller (e.g. from a geocoded autocomplete).
     */
    Double lat;

    Double lng;

    public boolean isStructured() {
        return address1 != null && !address1.isBlank();
    }

    public boolean hasCoordinates() {
        return lat != null && lng != null;
    }

    public boolean isEmpty() {
        return !isStructured() && (rawText == null || rawText.isBlank());
    }
}

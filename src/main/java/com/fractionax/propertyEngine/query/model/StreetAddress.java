package com.fractionax.propertyEngine.query.model;

import lombok.Builder;
import lombok.Value;

/**
 * Street address split into the components the providers search by.
 */
@Value
@Builder(toBuilder = true)
public class StreetAddress {

    /**
     * Street line, e.g. "1600 Amphitheatre Parkway".
     */
    String line1;

    String city;

    /**
     * Two-letter state code.
     */
    String state;

    String postalCode;

    /**
     * Renders the address as a single comma-separated line, skipping missing parts.
     *
     * @return e.g. "1600 Amphitheatre Parkway, Mountain View, CA 94043"
     */
    public String oneLine() {
        StringBuilder sb = new StringBuilder();
        if (line1 != null && !line1.isBlank()) {
            sb.append(line1.trim());
        }
        if (city != null && !city.isBlank()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(city.trim());
        }
        String stateAndZip = ((state != null ? state.trim() : "") + " "
                + (postalCode != null ? postalCode.trim() : "")).trim();
        if (!stateAndZip.isEmpty()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(stateAndZip);
        }
        return sb.toString();
    }
}

package com.fractionax.propertyEngine.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canonical address of a resolved property.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PropertyAddress {

    /**
     * Full address on one line, e.g. "1600 Amphitheatre Parkway, Mountain View, CA 94043".
     */
    private String oneLine;

    private String street;

    private String city;

    private String state;

    private String postalCode;
}

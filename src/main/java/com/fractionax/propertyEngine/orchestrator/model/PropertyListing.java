package com.fractionax.propertyEngine.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Listing fields. Populated from the listings provider only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PropertyListing {

    private String listingId;

    /**
     * Listed price, in USD. Null when the property is not on the market.
     */
    private Long priceMax;

    private String status;

    @Builder.Default
    private List<String> images = new ArrayList<>();
}

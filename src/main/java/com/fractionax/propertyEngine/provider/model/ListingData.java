package com.fractionax.propertyEngine.provider.model;

import com.fractionax.propertyEngine.query.model.StreetAddress;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A listing returned by a listings search.
 */
@Value
@Builder(toBuilder = true)
public class ListingData {

    String listingId;

    /**
     * Address as the provider printed it.
     */
    String addressText;

    /**
     * {@link #addressText} split into components, if it could be parsed.
     */
    StreetAddress address;

    Double latitude;

    Double longitude;

    Long price;

    String status;

    StructureData structure;

    List<String> images;
}

package com.fractionax.propertyEngine.provider.model;

import com.fractionax.propertyEngine.query.model.StreetAddress;
import lombok.Builder;
import lombok.Value;

/**
 * A parcel returned by an address or spatial lookup.
 */
@Value
@Builder
public class ParcelMatch {

    /**
     * Provider parcel identifier (CLIP).
     */
    String parcelId;

    /**
     * Situs address as recorded by the provider.
     */
    StreetAddress address;

    Double latitude;

    Double longitude;
}

package com.fractionax.propertyEngine.provider.model;

import lombok.Builder;
import lombok.Value;

/**
 * Building characteristics of a parcel or listing.
 */
@Value
@Builder
public class StructureData {

    String propertyType;

    Integer yearBuilt;

    Integer squareFeet;

    Integer bedrooms;

    Double bathrooms;
}

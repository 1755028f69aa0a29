package com.fractionax.propertyEngine.provider;

import com.fractionax.propertyEngine.provider.model.ParcelMatch;
import com.fractionax.propertyEngine.provider.model.StructureData;
import com.fractionax.propertyEngine.provider.model.ValuationData;
import com.fractionax.propertyEngine.query.model.StreetAddress;

import java.util.List;
import java.util.Optional;

/**
 * Capability set of a spatial / property / valuation provider.
 *
 * All operations throw {@link com.fractionax.propertyEngine.provider.exception.ProviderHttpException}
 * or {@link com.fractionax.propertyEngine.provider.exception.ProviderTimeoutException} after the
 * bounded retry, and {@link com.fractionax.propertyEngine.auth.exception.AuthException} when no
 * access token can be obtained.
 */
public interface PropertyDataProvider extends PropertyProvider {

    /**
     * Finds parcels around a coordinate.
     *
     * @param lat Latitude
     * @param lng Longitude
     * @return Parcel candidates, nearest first; empty if none
     */
    List<ParcelMatch> lookupBySpatial(double lat, double lng);

    /**
     * Finds the best-matching parcel for a street address.
     *
     * @param address Street address
     * @return Best match, or empty if the provider has no parcel for the address
     */
    Optional<ParcelMatch> lookupByAddress(StreetAddress address);

    StructureData getStructure(String parcelId);

    ValuationData getValuation(String parcelId);
}

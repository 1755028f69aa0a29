package com.fractionax.propertyEngine.orchestrator.service;

import com.fractionax.propertyEngine.orchestrator.model.CanonicalProperty;
import com.fractionax.propertyEngine.orchestrator.model.Coordinates;
import com.fractionax.propertyEngine.orchestrator.model.FieldAlternate;
import com.fractionax.propertyEngine.orchestrator.model.PropertyAddress;
import com.fractionax.propertyEngine.orchestrator.model.PropertyListing;
import com.fractionax.propertyEngine.orchestrator.model.PropertyStructure;
import com.fractionax.propertyEngine.orchestrator.model.PropertyValuation;
import com.fractionax.propertyEngine.provider.ProviderId;
import com.fractionax.propertyEngine.provider.model.ListingData;
import com.fractionax.propertyEngine.provider.model.ParcelMatch;
import com.fractionax.propertyEngine.provider.model.StructureData;
import com.fractionax.propertyEngine.provider.model.ValuationData;
import com.fractionax.propertyEngine.query.model.StreetAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Merge service - combines provider data into one {@link CanonicalProperty}.
 *
 * Precedence:
 * - parcel id, structure and valuation: property-data provider (CoreLogic)
 * - listing price, status and images: listings provider (Zillow) only
 * - structure field reported by both with different values: CoreLogic wins, Zillow value kept as an alternate
 * - address and coordinates: parcel first, listing as fallback
 */
@Slf4j
@Service
public class PropertyMergeService {

    /**
     * Merges whatever the providers returned for one property. Every argument may be null.
     *
     * @param parcel Parcel match from the property-data provider
     * @param structure Building data from the property-data provider
     * @param valuation Valuation from the property-data provider
     * @param listing Listing from the listings provider
     * @return Merged property with all nested objects present
     */
    public CanonicalProperty merge(ParcelMatch parcel, StructureData structure, ValuationData valuation, ListingData listing) {
        Set<ProviderId> sources = EnumSet.noneOf(ProviderId.class);
        List<FieldAlternate> alternates = new ArrayList<>();

        if (parcel != null || structure != null || valuation != null) {
            sources.add(ProviderId.CORELOGIC);
        }
        if (listing != null) {
            sources.add(ProviderId.ZILLOW);
        }

        return CanonicalProperty.builder()
                .parcelId(parcel != null ? parcel.getParcelId() : null)
                .address(mergeAddress(parcel, listing))
                .coordinates(mergeCoordinates(parcel, listing))
                .structure(mergeStructure(structure, listing != null ? listing.getStructure() : null, alternates))
                .valuation(toValuation(valuation))
                .listing(toListing(listing))
                .sources(sources)
                .alternates(alternates)
                .build();
    }

    private PropertyAddress mergeAddress(ParcelMatch parcel, ListingData listing) {
        StreetAddress address = parcel != null && parcel.getAddress() != null ? parcel.getAddress()
                : listing != null ? listing.getAddress() : null;

        if (address == null) {
            String text = listing != null ? listing.getAddressText() : null;
            return PropertyAddress.builder().oneLine(text).build();
        }

        return PropertyAddress.builder()
                .oneLine(address.oneLine())
                .street(address.getLine1())
                .city(address.getCity())
                .state(address.getState())
                .postalCode(address.getPostalCode())
                .build();
    }

    private Coordinates mergeCoordinates(ParcelMatch parcel, ListingData listing) {
        if (parcel != null && parcel.getLatitude() != null && parcel.getLongitude() != null) {
            return new Coordinates(parcel.getLatitude(), parcel.getLongitude());
        }
        if (listing != null && listing.getLatitude() != null && listing.getLongitude() != null) {
            return new Coordinates(listing.getLatitude(), listing.getLongitude());
        }
        return new Coordinates();
    }

    private PropertyStructure mergeStructure(StructureData primary, StructureData listing, List<FieldAlternate> alternates) {
        PropertyStructure merged = new PropertyStructure();
        pick("structure.propertyType", value(primary, StructureData::getPropertyType),
                value(listing, StructureData::getPropertyType), merged::setPropertyType, alternates);
        pick("structure.yearBuilt", value(primary, StructureData::getYearBuilt),
                value(listing, StructureData::getYearBuilt), merged::setYearBuilt, alternates);
        pick("structure.squareFeet", value(primary, StructureData::getSquareFeet),
                value(listing, StructureData::getSquareFeet), merged::setSquareFeet, alternates);
        pick("structure.bedrooms", value(primary, StructureData::getBedrooms),
                value(listing, StructureData::getBedrooms), merged::setBedrooms, alternates);
        pick("structure.bathrooms", value(primary, StructureData::getBathrooms),
                value(listing, StructureData::getBathrooms), merged::setBathrooms, alternates);
        return merged;
    }

    private <T> void pick(String field, T primary, T listing, Consumer<T> setter, List<FieldAlternate> alternates) {
        if (primary != null) {
            setter.accept(primary);
            if (listing != null && !Objects.equals(primary, listing)) {
                alternates.add(new FieldAlternate(field, ProviderId.ZILLOW, listing));
                log.debug("Merge conflict - field: {}, corelogic: {}, zillow: {}", field, primary, listing);
            }
        } else {
            setter.accept(listing);
        }
    }

    private static <T> T value(StructureData data, Function<StructureData, T> getter) {
        return data != null ? getter.apply(data) : null;
    }

    private PropertyValuation toValuation(ValuationData valuation) {
        if (valuation == null) {
            return new PropertyValuation();
        }
        return new PropertyValuation(valuation.getCurrentValue(), valuation.getAssessedValue());
    }

    private PropertyListing toListing(ListingData listing) {
        if (listing == null) {
            return new PropertyListing();
        }
        return PropertyListing.builder()
                .listingId(listing.getListingId())
                .priceMax(listing.getPrice())
                .status(listing.getStatus())
                .images(listing.getImages() != null ? new ArrayList<>(listing.getImages()) : new ArrayList<>())
                .build();
    }
}

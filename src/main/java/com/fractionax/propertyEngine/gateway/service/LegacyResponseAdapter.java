package com.fractionax.propertyEngine.gateway.service;

import com.fractionax.propertyEngine.gateway.dto.LegacySearchResponse;
import com.fractionax.propertyEngine.orchestrator.model.CanonicalProperty;
import com.fractionax.propertyEngine.orchestrator.model.PropertyAddress;
import com.fractionax.propertyEngine.orchestrator.model.PropertyResolution;
import com.fractionax.propertyEngine.orchestrator.model.ResolutionError;
import com.fractionax.propertyEngine.provider.ProviderId;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link PropertyResolution} in the response shape of the legacy AI search endpoint.
 */
@Service
public class LegacyResponseAdapter {

    static final String MERGED_SOURCE = "merged";

    public LegacySearchResponse toLegacy(String searchQuery, PropertyResolution resolution) {
        ResolutionError error = resolution.getError();
        if (error != null) {
            return LegacySearchResponse.builder()
                    .error(legacyErrorTitle(error))
                    .details(error.message())
                    .httpStatus(error.code().getHttpStatus())
                    .build();
        }

        List<LegacySearchResponse.Listing> listings = resolution.getResults().stream()
                .map(this::toListing)
                .toList();

        return LegacySearchResponse.builder()
                .fromCache(resolution.getMetadata() != null && resolution.getMetadata().isFromCache())
                .listings(listings)
                .metadata(LegacySearchResponse.Metadata.builder()
                        .searchQuery(searchQuery)
                        .searchType(resolution.getMetadata() != null && resolution.getMetadata().getSearchType() != null
                                ? resolution.getMetadata().getSearchType().name().toLowerCase(Locale.ROOT)
                                : null)
                        .totalFound(listings.size())
                        .build())
                .httpStatus(200)
                .build();
    }

    private LegacySearchResponse.Listing toListing(CanonicalProperty property) {
        PropertyAddress address = property.getAddress();
        List<String> images = property.getListing().getImages() != null ? property.getListing().getImages() : List.of();
        String zpid = property.getListing().getListingId();

        return LegacySearchResponse.Listing.builder()
                .id(zpid != null ? zpid : property.getParcelId())
                .price(property.getListing().getPriceMax() != null
                        ? property.getListing().getPriceMax()
                        : property.getValuation().getCurrentValue())
                .beds(property.getStructure().getBedrooms())
                .baths(property.getStructure().getBathrooms())
                .sqft(property.getStructure().getSquareFeet())
                .address(LegacySearchResponse.Address.builder()
                        .oneLine(address.getOneLine())
                        .street(address.getStreet())
                        .city(address.getCity())
                        .state(address.getState())
                        .zip(address.getPostalCode())
                        .build())
                .location(new LegacySearchResponse.Location(
                        property.getCoordinates().getLatitude(), property.getCoordinates().getLongitude()))
                .imgSrc(images.isEmpty() ? null : images.get(0))
                .carouselPhotos(images)
                .zpid(zpid)
                .dataSource(dataSource(property))
                .build();
    }

    private String dataSource(CanonicalProperty property) {
        if (property.getSources().size() > 1) {
            return MERGED_SOURCE;
        }
        return property.getSources().stream().findFirst().map(ProviderId::id).orElse(null);
    }

    private String legacyErrorTitle(ResolutionError error) {
        return switch (error.code()) {
            case INVALID_QUERY -> "Invalid search query";
            case NOT_FOUND -> "Property not found";
            case PROVIDER_AUTH_FAILED, PROVIDER_ERROR -> "Failed to fetch listings";
            case PROVIDER_TIMEOUT -> "Listing search timed out";
            case INTERNAL_ERROR -> "Search failed";
        };
    }
}

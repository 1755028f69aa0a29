package com.fractionax.propertyEngine.provider.zillow.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response of the Zillow (RapidAPI) {@code /propertyExtendedSearch} endpoint.
 *
 * A location search returns a page of {@code props}. An exact-address search returns the
 * single matching property at the top level instead.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ZillowSearchResponse {

    private List<Property> props;

    private Integer totalResultCount;

    private Integer resultsPerPage;

    private Integer totalPages;

    // Exact-address match fields
    private String zpid;
    private String address;
    private Long price;
    private Integer bedrooms;
    private Double bathrooms;
    private Integer livingArea;
    private Double latitude;
    private Double longitude;
    private String propertyType;
    private String homeStatus;
    private String imgSrc;

    public boolean isSingleMatch() {
        return (props == null || props.isEmpty()) && zpid != null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Property {
        private String zpid;
        private String address;
        private Long price;
        private Integer bedrooms;
        private Double bathrooms;
        private Integer livingArea;
        private Double latitude;
        private Double longitude;
        private String propertyType;
        private String listingStatus;
        private String imgSrc;
        private List<Photo> carouselPhotos;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Photo {
        private String url;
    }
}

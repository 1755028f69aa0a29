package com.fractionax.propertyEngine.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO of the legacy AI search endpoint.
 * On failure only {@code error} and {@code details} are set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LegacySearchResponse {

    private Boolean fromCache;
    private List<Listing> listings;
    private Metadata metadata;

    private String error;
    private String details;

    @JsonIgnore
    private int httpStatus;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public static class Listing {
        private String id;
        private Long price;
        private Integer beds;
        private Double baths;
        private Integer sqft;
        private Address address;
        private Location location;
        private String imgSrc;
        private List<String> carouselPhotos;
        private String zpid;
        private String dataSource;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public static class Address {
        private String oneLine;
        private String street;
        private String city;
        private String state;
        private String zip;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public static class Location {
        private Double latitude;
        private Double longitude;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Metadata {
        private String searchQuery;
        private String searchType;
        private int totalFound;
    }
}

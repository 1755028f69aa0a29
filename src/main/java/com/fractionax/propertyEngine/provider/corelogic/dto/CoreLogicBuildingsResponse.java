package com.fractionax.propertyEngine.provider.corelogic.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response of the CoreLogic buildings endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CoreLogicBuildingsResponse {

    private String clip;

    /**
     * Land-use description, e.g. "SINGLE FAMILY RESIDENCE".
     */
    private String propertyType;

    private List<Building> buildings;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Building {
        private Integer yearBuilt;
        private Integer livingAreaSquareFeet;
        private Integer bedroomsCount;
        private Double bathroomsCount;
    }
}

package com.fractionax.propertyEngine.provider.corelogic.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response of the CoreLogic AVM (automated valuation model) endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CoreLogicAvmResponse {

    private String clip;

    private Valuation valuation;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Valuation {
        private Long estimatedValue;
        private Long taxAssessedValue;
        private Integer confidenceScore;
    }
}

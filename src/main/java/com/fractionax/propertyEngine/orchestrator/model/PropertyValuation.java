package com.fractionax.propertyEngine.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PropertyValuation {

    /**
     * Automated estimate of the current market value, in USD.
     */
    private Long currentValue;

    /**
     * Tax-assessed value, in USD.
     */
    private Long assessedValue;
}

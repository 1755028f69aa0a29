package com.fractionax.propertyEngine.provider.model;

import lombok.Builder;
import lombok.Value;

/**
 * Valuation of a parcel: automated estimate plus tax assessment.
 */
@Value
@Builder
public class ValuationData {

    Long currentValue;

    Long assessedValue;

    /**
     * Provider confidence in the automated estimate (0-100), if reported.
     */
    Integer confidenceScore;
}

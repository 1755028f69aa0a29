package com.fractionax.propertyEngine.verification.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of cross-checking a resolved property against the query that produced it.
 */
@Value
@Builder
public class VerificationEnvelope {

    boolean valid;

    /**
     * Why the result is not valid (empty when valid).
     */
    @Singular
    List<String> reasons;

    /**
     * Fields that were checked and matched, e.g. "streetNumber" or "maxPrice:provider".
     */
    @Singular
    List<String> matchedFields;
}

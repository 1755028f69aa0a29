package com.fractionax.propertyEngine.orchestrator.model;

import com.fractionax.propertyEngine.verification.model.VerificationEnvelope;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of resolving one query: results, or an error plus whatever was resolved before it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PropertyResolution {

    @Builder.Default
    private List<CanonicalProperty> results = new ArrayList<>();

    /**
     * Response-level verification envelope.
     */
    private VerificationEnvelope verification;

    private ResolutionMetadata metadata;

    /**
     * Set when the resolution failed.
     */
    private ResolutionError error;

    public boolean isSuccess() {
        return error == null;
    }
}

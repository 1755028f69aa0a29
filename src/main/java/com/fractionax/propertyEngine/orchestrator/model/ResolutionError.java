package com.fractionax.propertyEngine.orchestrator.model;

import com.fractionax.propertyEngine.provider.ProviderId;

/**
 * Typed error of a failed resolution.
 *
 * @param code Error code
 * @param message Human-readable message
 * @param provider Provider whose call failed, or null
 */
public record ResolutionError(ResolutionErrorCode code, String message, ProviderId provider) {
}

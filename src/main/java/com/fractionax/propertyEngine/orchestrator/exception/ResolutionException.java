package com.fractionax.propertyEngine.orchestrator.exception;

import com.fractionax.propertyEngine.orchestrator.model.ResolutionError;
import com.fractionax.propertyEngine.orchestrator.model.ResolutionErrorCode;
import com.fractionax.propertyEngine.provider.ProviderId;

/**
 * Exception thrown when a primary provider call fails and the query cannot be resolved.
 *
 * Never leaves the orchestrator: it is turned into a {@link ResolutionError}.
 */
public class ResolutionException extends RuntimeException {

    private final ResolutionErrorCode code;
    private final ProviderId providerId;

    public ResolutionException(ResolutionErrorCode code, ProviderId providerId, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.providerId = providerId;
    }

    public ResolutionErrorCode getCode() {
        return code;
    }

    public ProviderId getProviderId() {
        return providerId;
    }

    public ResolutionError toError() {
        return new ResolutionError(code, getMessage(), providerId);
    }
}

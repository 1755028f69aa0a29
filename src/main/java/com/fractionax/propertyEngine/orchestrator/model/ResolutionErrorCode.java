package com.fractionax.propertyEngine.orchestrator.model;

/**
 * Error codes of a failed resolution, with the HTTP status the gateway answers with.
 */
public enum ResolutionErrorCode {
    INVALID_QUERY(400),
    NOT_FOUND(404),
    PROVIDER_AUTH_FAILED(502),
    PROVIDER_ERROR(502),
    PROVIDER_TIMEOUT(504),
    INTERNAL_ERROR(500);

    private final int httpStatus;

    ResolutionErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}

package com.fractionax.propertyEngine.orchestrator.model;

import com.fractionax.propertyEngine.provider.ProviderId;

/**
 * Outcome of a non-fatal enrichment call: a value, nothing found, or a failure.
 */
public final class EnrichmentResult<T> {

    public enum Status { PRESENT, ABSENT, FAILED }

    private final ProviderId providerId;
    private final Status status;
    private final T value;
    private final Throwable failure;

    private EnrichmentResult(ProviderId providerId, Status status, T value, Throwable failure) {
        this.providerId = providerId;
        this.status = status;
        this.value = value;
        this.failure = failure;
    }

    public static <T> EnrichmentResult<T> present(ProviderId providerId, T value) {
        return value == null ? absent(providerId) : new EnrichmentResult<>(providerId, Status.PRESENT, value, null);
    }

    public static <T> EnrichmentResult<T> absent(ProviderId providerId) {
        return new EnrichmentResult<>(providerId, Status.ABSENT, null, null);
    }

    public static <T> EnrichmentResult<T> failed(ProviderId providerId, Throwable failure) {
        return new EnrichmentResult<>(providerId, Status.FAILED, null, failure);
    }

    public ProviderId getProviderId() {
        return providerId;
    }

    public Status getStatus() {
        return status;
    }

    public T getValue() {
        return value;
    }

    public Throwable getFailure() {
        return failure;
    }

    public boolean isPresent() {
        return status == Status.PRESENT;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    /**
     * Data-source status this outcome contributes for its provider.
     */
    public DataSourceStatus toDataSourceStatus() {
        return switch (status) {
            case PRESENT -> DataSourceStatus.USED;
            case ABSENT -> DataSourceStatus.NOT_FOUND;
            case FAILED -> DataSourceStatus.FAILED;
        };
    }
}

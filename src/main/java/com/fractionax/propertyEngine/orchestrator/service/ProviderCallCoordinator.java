package com.fractionax.propertyEngine.orchestrator.service;

import com.fractionax.propertyEngine.auth.exception.AuthException;
import com.fractionax.propertyEngine.orchestrator.exception.ResolutionException;
import com.fractionax.propertyEngine.orchestrator.model.EnrichmentResult;
import com.fractionax.propertyEngine.orchestrator.model.ResolutionErrorCode;
import com.fractionax.propertyEngine.provider.ProviderId;
import com.fractionax.propertyEngine.provider.exception.ProviderHttpException;
import com.fractionax.propertyEngine.provider.exception.ProviderTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs provider calls for the resolution services with the primary / enrichment failure policy.
 *
 * - primary: any failure becomes a {@link ResolutionException} and ends the resolution
 * - enrichment: failures are logged and returned as {@link EnrichmentResult#failed}
 */
@Slf4j
@Component
public class ProviderCallCoordinator {

    private final Executor executor;

    public ProviderCallCoordinator(@Qualifier("providerExecutor") Executor executor) {
        this.executor = executor;
    }

    /**
     * Runs a primary call on the calling thread.
     *
     * @throws ResolutionException if the call fails
     */
    public <T> T primary(ProviderId providerId, String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            throw toResolutionException(providerId, operation, e);
        }
    }

    /**
     * Starts a primary call on the provider executor. Join with {@link #join(CompletableFuture)}.
     */
    public <T> CompletableFuture<T> primaryAsync(ProviderId providerId, String operation, Supplier<T> call) {
        return CompletableFuture.supplyAsync(() -> primary(providerId, operation, call), executor);
    }

    /**
     * Runs an enrichment call on the calling thread; never throws.
     */
    public <T> EnrichmentResult<T> enrich(ProviderId providerId, String operation, Supplier<T> call) {
        try {
            return EnrichmentResult.present(providerId, call.get());
        } catch (RuntimeException e) {
            log.warn("Enrichment call failed, continuing without it - provider: {}, operation: {}, error: {}",
                    providerId, operation, e.getMessage());
            return EnrichmentResult.failed(providerId, e);
        }
    }

    /**
     * Starts an enrichment call on the provider executor. The future never completes exceptionally.
     */
    public <T> CompletableFuture<EnrichmentResult<T>> enrichAsync(ProviderId providerId, String operation, Supplier<T> call) {
        return CompletableFuture.supplyAsync(() -> enrich(providerId, operation, call), executor);
    }

    /**
     * Waits for a primary call started with {@link #primaryAsync}.
     *
     * @throws ResolutionException if the call failed
     */
    public <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ResolutionException resolutionException) {
                throw resolutionException;
            }
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw e;
        }
    }

    private ResolutionException toResolutionException(ProviderId providerId, String operation, RuntimeException e) {
        if (e instanceof ResolutionException resolutionException) {
            return resolutionException;
        }
        if (e instanceof AuthException) {
            log.error("Primary call failed to authenticate - provider: {}, operation: {}, error: {}",
                    providerId, operation, e.getMessage());
            return new ResolutionException(ResolutionErrorCode.PROVIDER_AUTH_FAILED, providerId,
                    "Authentication with " + providerId + " failed", e);
        }
        if (e instanceof ProviderTimeoutException) {
            log.error("Primary call timed out - provider: {}, operation: {}", providerId, operation);
            return new ResolutionException(ResolutionErrorCode.PROVIDER_TIMEOUT, providerId,
                    providerId + " did not respond in time (" + operation + ")", e);
        }
        if (e instanceof ProviderHttpException httpException) {
            if (httpException.getStatus() == 404) {
                log.info("Primary call found nothing - provider: {}, operation: {}", providerId, operation);
                return new ResolutionException(ResolutionErrorCode.NOT_FOUND, providerId,
                        providerId + " has no record for the request (" + operation + ")", e);
            }
            log.error("Primary call failed - provider: {}, operation: {}, status: {}",
                    providerId, operation, httpException.getStatus());
            return new ResolutionException(ResolutionErrorCode.PROVIDER_ERROR, providerId,
                    providerId + " " + operation + " failed with HTTP status " + httpException.getStatus(), e);
        }
        if (e instanceof IllegalArgumentException) {
            return new ResolutionException(ResolutionErrorCode.INVALID_QUERY, providerId, e.getMessage(), e);
        }
        log.error("Primary call failed unexpectedly - provider: {}, operation: {}", providerId, operation, e);
        return new ResolutionException(ResolutionErrorCode.INTERNAL_ERROR, providerId,
                "Unexpected failure calling " + providerId + " (" + operation + ")", e);
    }
}

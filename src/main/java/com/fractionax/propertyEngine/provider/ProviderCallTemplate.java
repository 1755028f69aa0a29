package com.fractionax.propertyEngine.provider;

import com.fractionax.propertyEngine.auth.exception.AuthException;
import com.fractionax.propertyEngine.provider.exception.ProviderException;
import com.fractionax.propertyEngine.provider.exception.ProviderHttpException;
import com.fractionax.propertyEngine.provider.exception.ProviderTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.function.Supplier;

/**
 * Runs provider HTTP calls with the engine's retry and error-translation rules.
 *
 * - HTTP error statuses become {@link ProviderHttpException}
 * - timeouts and connection failures become {@link ProviderTimeoutException}
 * - 5xx and timeouts get exactly one immediate retry; 4xx is never retried
 * - {@link AuthException} passes through untouched
 */
@Slf4j
@Component
public class ProviderCallTemplate {

    /**
     * Status reported when the provider answered 2xx but the body could not be read.
     */
    static final int UNREADABLE_RESPONSE_STATUS = 502;

    /**
     * Executes a provider call.
     *
     * @param providerId Provider being called
     * @param operation Operation name for logs and errors (e.g. "lookupByAddress")
     * @param call The HTTP call
     * @return Call result
     * @throws ProviderException after retry exhaustion or on a non-retryable failure
     */
    public <T> T execute(ProviderId providerId, String operation, Supplier<T> call) {
        long start = System.nanoTime();
        try {
            T result = call.get();
            log.debug("Provider call succeeded - provider: {}, operation: {}, elapsedMs: {}",
                    providerId, operation, elapsedMs(start));
            return result;
        } catch (AuthException e) {
            throw e;
        } catch (RuntimeException e) {
            ProviderException failure = translate(providerId, operation, e);
            if (!failure.isRetryable()) {
                log.warn("Provider call failed (not retried) - provider: {}, operation: {}, error: {}",
                        providerId, operation, failure.getMessage());
                throw failure;
            }
            log.warn("Provider call failed, retrying once - provider: {}, operation: {}, error: {}",
                    providerId, operation, failure.getMessage());
        }

        try {
            T result = call.get();
            log.info("Provider call succeeded on retry - provider: {}, operation: {}, elapsedMs: {}",
                    providerId, operation, elapsedMs(start));
            return result;
        } catch (AuthException e) {
            throw e;
        } catch (RuntimeException e) {
            ProviderException failure = translate(providerId, operation, e);
            log.error("Provider call failed after retry - provider: {}, operation: {}, error: {}",
                    providerId, operation, failure.getMessage());
            throw failure;
        }
    }

    private ProviderException translate(ProviderId providerId, String operation, RuntimeException e) {
        if (e instanceof ProviderException providerException) {
            return providerException;
        }
        if (e instanceof RestClientResponseException responseException) {
            return new ProviderHttpException(providerId, operation, responseException.getStatusCode().value(), e);
        }
        if (e instanceof ResourceAccessException) {
            return new ProviderTimeoutException(providerId, operation, e);
        }
        if (e instanceof RestClientException) {
            return new ProviderHttpException(providerId, operation, UNREADABLE_RESPONSE_STATUS, e);
        }
        throw e;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}

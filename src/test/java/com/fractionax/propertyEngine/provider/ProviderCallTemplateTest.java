package com.fractionax.propertyEngine.provider;

import com.fractionax.propertyEngine.auth.exception.AuthException;
import com.fractionax.propertyEngine.provider.exception.ProviderHttpException;
import com.fractionax.propertyEngine.provider.exception.ProviderTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class ProviderCallTemplateTest {

    private final ProviderCallTemplate template = new ProviderCallTemplate();

    /**
     * Supplier that throws the given failures in order, then returns "ok".
     */
    private static Supplier<String> failing(AtomicInteger calls, RuntimeException... failures) {
        return () -> {
            int attempt = calls.getAndIncrement();
            if (attempt < failures.length) {
                throw failures[attempt];
            }
            return "ok";
        };
    }

    @Test
    @DisplayName("successful call runs once")
    void successRunsOnce() {
        AtomicInteger calls = new AtomicInteger();

        assertEquals("ok", template.execute(ProviderId.ZILLOW, "searchByLocation", failing(calls)));
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("5xx is retried once")
    void serverErrorIsRetried() {
        AtomicInteger calls = new AtomicInteger();

        String result = template.execute(ProviderId.CORELOGIC, "getStructure",
                failing(calls, new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE)));

        assertEquals("ok", result);
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("4xx is not retried and keeps its status")
    void clientErrorIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        ProviderHttpException ex = assertThrows(ProviderHttpException.class, () -> template.execute(
                ProviderId.CORELOGIC, "getStructure", failing(calls, new HttpClientErrorException(HttpStatus.NOT_FOUND))));

        assertEquals(404, ex.getStatus());
        assertEquals(ProviderId.CORELOGIC, ex.getProviderId());
        assertEquals("getStructure", ex.getOperation());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("timeout twice surfaces as ProviderTimeoutException after one retry")
    void timeoutAfterRetry() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(ProviderTimeoutException.class, () -> template.execute(ProviderId.ZILLOW, "searchByLocation",
                failing(calls, new ResourceAccessException("Read timed out"), new ResourceAccessException("Read timed out"))));
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("5xx on the retry surfaces the second status")
    void serverErrorTwice() {
        AtomicInteger calls = new AtomicInteger();

        ProviderHttpException ex = assertThrows(ProviderHttpException.class, () -> template.execute(
                ProviderId.ZILLOW, "getImages", failing(calls,
                        new HttpServerErrorException(HttpStatus.BAD_GATEWAY),
                        new HttpServerErrorException(HttpStatus.INTERNAL_SERVER_ERROR))));

        assertEquals(500, ex.getStatus());
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("unreadable response body is reported as a 502")
    void unreadableBody() {
        AtomicInteger calls = new AtomicInteger();

        ProviderHttpException ex = assertThrows(ProviderHttpException.class, () -> template.execute(
                ProviderId.ZILLOW, "searchByLocation", failing(calls,
                        new RestClientException("Could not extract response"),
                        new RestClientException("Could not extract response"))));

        assertEquals(502, ex.getStatus());
    }

    @Test
    @DisplayName("AuthException passes through untouched and is not retried")
    void authExceptionPassesThrough() {
        AtomicInteger calls = new AtomicInteger();
        AuthException auth = new AuthException(ProviderId.CORELOGIC, "rejected");

        AuthException ex = assertThrows(AuthException.class,
                () -> template.execute(ProviderId.CORELOGIC, "lookupByAddress", failing(calls, auth)));

        assertSame(auth, ex);
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("non-HTTP failures propagate unchanged")
    void programmingErrorsPropagate() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> template.execute(ProviderId.ZILLOW, "searchByLocation",
                failing(calls, new IllegalStateException("bug"))));
        assertEquals(1, calls.get());
    }
}

package com.fractionax.propertyEngine.gateway.service;

import com.fractionax.propertyEngine.gateway.util.SecretMasker;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Simple in-memory rate limiter: sliding one-minute window per client.
 */
@Slf4j
@Service
public class RateLimiter {

    private static final long WINDOW_SIZE_SECONDS = 60;

    private final int maxRequestsPerMinute;
    private final Clock clock;

    // Client key -> request timestamps; idle clients drop out once their window is empty
    private final Cache<String, RequestWindow> clientWindows;

    public RateLimiter(@Value("${gateway.rate-limit.requests-per-minute:30}") int maxRequestsPerMinute, Clock clock) {
        this.maxRequestsPerMinute = maxRequestsPerMinute;
        this.clock = clock;
        this.clientWindows = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofSeconds(WINDOW_SIZE_SECONDS))
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    /**
     * Checks if the request should be allowed based on rate limiting.
     *
     * @param clientKey The client to check rate limit for
     * @return true if request is allowed, false if rate limit exceeded
     */
    public boolean isAllowed(String clientKey) {
        RequestWindow window = clientWindows.get(clientKey, k -> new RequestWindow());

        Instant now = clock.instant();
        if (!window.tryAdd(now, maxRequestsPerMinute)) {
            log.warn("Rate limit exceeded for client: {}", SecretMasker.mask(clientKey));
            return false;
        }
        return true;
    }

    /**
     * Number of clients with a live window.
     */
    long trackedClients() {
        clientWindows.cleanUp();
        return clientWindows.estimatedSize();
    }

    /**
     * Tracks the request window of one client.
     */
    private static class RequestWindow {
        private final List<Instant> requests = new ArrayList<>();

        synchronized boolean tryAdd(Instant now, int limit) {
            Instant cutoff = now.minusSeconds(WINDOW_SIZE_SECONDS);
            requests.removeIf(timestamp -> !timestamp.isAfter(cutoff));
            if (requests.size() >= limit) {
                return false;
            }
            requests.add(now);
            return true;
        }
    }
}

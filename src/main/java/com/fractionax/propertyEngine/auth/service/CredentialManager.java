package com.fractionax.propertyEngine.auth.service;

import com.fractionax.propertyEngine.auth.dto.OAuthTokenResponse;
import com.fractionax.propertyEngine.auth.exception.AuthException;
import com.fractionax.propertyEngine.auth.model.ClientCredentials;
import com.fractionax.propertyEngine.auth.model.ProviderToken;
import com.fractionax.propertyEngine.gateway.util.SecretMasker;
import com.fractionax.propertyEngine.provider.ProviderId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Credential manager - acquires and caches provider access tokens.
 *
 * Responsibilities:
 * - Perform the client-credentials exchange on first use or when the cached token is stale
 * - Refresh proactively: a token whose remaining lifetime is below the safety margin is never handed out
 * - Coalesce concurrent refreshes of the same provider into one token call
 * - One immediate retry on a network failure; credential rejections are not retried
 *
 * One instance per process, created and torn down by the Spring context.
 */
@Slf4j
public class CredentialManager {

    private final OAuthTokenClient tokenClient;
    private final Map<ProviderId, ClientCredentials> credentials;
    private final Duration safetyMargin;
    private final Clock clock;

    private final Map<ProviderId, ProviderToken> tokens = new ConcurrentHashMap<>();
    private final Map<ProviderId, Object> refreshLocks = new ConcurrentHashMap<>();

    public CredentialManager(OAuthTokenClient tokenClient,
                             Map<ProviderId, ClientCredentials> credentials,
                             Duration safetyMargin,
                             Clock clock) {
        this.tokenClient = tokenClient;
        this.credentials = credentials.isEmpty() ? new EnumMap<>(ProviderId.class) : new EnumMap<>(credentials);
        this.safetyMargin = safetyMargin;
        this.clock = clock;
    }

    /**
     * Returns a token for the provider that stays valid for at least the safety margin.
     *
     * @param providerId Provider to authenticate against
     * @return Fresh token
     * @throws AuthException if the provider is not configured, rejects the credentials, or is unreachable
     */
    public ProviderToken getToken(ProviderId providerId) {
        ProviderToken cached = tokens.get(providerId);
        if (cached != null && cached.isFreshAt(clock.instant(), safetyMargin)) {
            return cached;
        }

        Object lock = refreshLocks.computeIfAbsent(providerId, id -> new Object());
        synchronized (lock) {
            ProviderToken current = tokens.get(providerId);
            if (current != null && current.isFreshAt(clock.instant(), safetyMargin)) {
                log.debug("Token refreshed by concurrent caller - provider: {}", providerId);
                return current;
            }

            ProviderToken refreshed = exchange(providerId);
            tokens.put(providerId, refreshed);
            return refreshed;
        }
    }

    /**
     * Drops the cached token, e.g. after the provider answered 401 with it.
     */
    public void invalidate(ProviderId providerId) {
        if (tokens.remove(providerId) != null) {
            log.info("Access token invalidated - provider: {}", providerId);
        }
    }

    /**
     * Clears every cached token. Called when the application context shuts down.
     */
    public void clear() {
        tokens.clear();
        log.debug("Token cache cleared");
    }

    private ProviderToken exchange(ProviderId providerId) {
        ClientCredentials clientCredentials = credentials.get(providerId);
        if (clientCredentials == null || !clientCredentials.isConfigured()) {
            throw new AuthException(providerId, "Client credentials not configured for " + providerId);
        }

        log.info("Fetching new access token - provider: {}, clientId: {}",
                providerId, SecretMasker.mask(clientCredentials.getClientId()));

        OAuthTokenResponse response;
        try {
            response = tokenClient.requestToken(clientCredentials);
        } catch (ResourceAccessException e) {
            log.warn("Token endpoint unreachable, retrying once - provider: {}, error: {}", providerId, e.getMessage());
            response = requestOrFail(providerId, clientCredentials);
        } catch (RestClientException e) {
            throw toAuthException(providerId, e);
        }

        return toToken(providerId, response);
    }

    private OAuthTokenResponse requestOrFail(ProviderId providerId, ClientCredentials clientCredentials) {
        try {
            return tokenClient.requestToken(clientCredentials);
        } catch (RestClientException e) {
            throw toAuthException(providerId, e);
        }
    }

    private AuthException toAuthException(ProviderId providerId, RestClientException e) {
        if (e instanceof RestClientResponseException responseException) {
            log.error("Token request rejected - provider: {}, status: {}", providerId, responseException.getStatusCode());
            return new AuthException(providerId,
                    "Token request rejected by " + providerId + " with status " + responseException.getStatusCode().value(), e);
        }
        log.error("Token request failed - provider: {}, error: {}", providerId, e.getMessage());
        return new AuthException(providerId, "Failed to get " + providerId + " access token: " + e.getMessage(), e);
    }

    private ProviderToken toToken(ProviderId providerId, OAuthTokenResponse response) {
        if (response == null || response.getAccessToken() == null || response.getAccessToken().isBlank()) {
            throw new AuthException(providerId, "Token endpoint of " + providerId + " returned no access token");
        }
        if (response.getExpiresIn() == null || response.getExpiresIn() <= 0) {
            throw new AuthException(providerId, "Token endpoint of " + providerId + " returned no expiry");
        }

        Instant expiresAt = clock.instant().plusSeconds(response.getExpiresIn());
        if (response.getExpiresIn() <= safetyMargin.getSeconds()) {
            log.warn("Token lifetime {}s is within the safety margin {}s - provider: {}",
                    response.getExpiresIn(), safetyMargin.getSeconds(), providerId);
        }

        log.info("Access token obtained - provider: {}, expiresAt: {}", providerId, expiresAt);
        return ProviderToken.builder()
                .providerId(providerId)
                .accessToken(response.getAccessToken())
                .expiresAt(expiresAt)
                .build();
    }
}

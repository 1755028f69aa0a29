package com.fractionax.propertyEngine.gateway.service;

import com.fractionax.propertyEngine.gateway.dto.LegacySearchRequest;
import com.fractionax.propertyEngine.gateway.dto.LegacySearchResponse;
import com.fractionax.propertyEngine.gateway.dto.PropertySearchRequest;
import com.fractionax.propertyEngine.gateway.dto.PropertySearchResponse;
import com.fractionax.propertyEngine.gateway.exception.InvalidQueryException;
import com.fractionax.propertyEngine.gateway.exception.RateLimitExceededException;
import com.fractionax.propertyEngine.gateway.model.RequestContext;
import com.fractionax.propertyEngine.gateway.util.SecretMasker;
import com.fractionax.propertyEngine.orchestrator.model.PropertyResolution;
import com.fractionax.propertyEngine.orchestrator.service.PropertyResolutionOrchestrator;
import com.fractionax.propertyEngine.query.model.PropertyQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.function.Function;

/**
 * Gateway service - handles the request-level concerns in front of the orchestrator.
 *
 * Responsibilities:
 * - Resolve the client key (X-Client-ID header, remote address as fallback)
 * - Generate correlationId and expose it to every log line through the MDC
 * - Enforce rate limiting
 * - Validate that the request carries something to search for
 * - Forward to the orchestrator and render its outcome
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchGatewayService {

    private final CorrelationIdService correlationIdService;
    private final RateLimiter rateLimiter;
    private final PropertyResolutionOrchestrator orchestrator;
    private final LegacyResponseAdapter legacyResponseAdapter;
    private final Clock clock;

    /**
     * Processes a property search.
     *
     * @throws InvalidQueryException if the request has neither a query nor an address
     * @throws RateLimitExceededException if rate limit is exceeded
     */
    public PropertySearchResponse search(PropertySearchRequest request, String clientIdHeader, String remoteAddress) {
        PropertyQuery query = request.toPropertyQuery();
        if (query.isEmpty()) {
            throw new InvalidQueryException("Provide either 'query' or 'address1'");
        }

        return withContext(clientIdHeader, remoteAddress, context -> {
            log.info("Search request received - correlationId: {}, client: {}, structured: {}",
                    context.getCorrelationId(), SecretMasker.mask(context.getClientKey()), query.isStructured());
            PropertyResolution resolution = orchestrator.resolve(query, context);
            return PropertySearchResponse.from(resolution, context.getCorrelationId());
        });
    }

    /**
     * Processes a parcel details request.
     *
     * @throws RateLimitExceededException if rate limit is exceeded
     */
    public PropertySearchResponse parcel(String parcelId, String clientIdHeader, String remoteAddress) {
        return withContext(clientIdHeader, remoteAddress, context -> {
            log.info("Parcel request received - correlationId: {}, parcelId: {}", context.getCorrelationId(), parcelId);
            PropertyResolution resolution = orchestrator.resolveParcel(parcelId, context);
            return PropertySearchResponse.from(resolution, context.getCorrelationId());
        });
    }

    /**
     * Processes a legacy AI search request.
     *
     * @throws RateLimitExceededException if rate limit is exceeded
     */
    public LegacySearchResponse legacySearch(LegacySearchRequest request, String clientIdHeader, String remoteAddress) {
        return withContext(clientIdHeader, remoteAddress, context -> {
            log.info("Legacy search request received - correlationId: {}", context.getCorrelationId());
            PropertyQuery query = PropertyQuery.builder().rawText(request.getQuery()).build();
            PropertyResolution resolution = orchestrator.resolve(query, context);
            return legacyResponseAdapter.toLegacy(request.getQuery(), resolution);
        });
    }

    private <T> T withContext(String clientIdHeader, String remoteAddress, Function<RequestContext, T> handler) {
        String clientKey = resolveClientKey(clientIdHeader, remoteAddress);
        String correlationId = correlationIdService.bindNew();
        try {
            validateRateLimit(clientKey, correlationId);
            RequestContext context = RequestContext.builder()
                    .clientKey(clientKey)
                    .correlationId(correlationId)
                    .receivedAt(clock.instant())
                    .build();
            return handler.apply(context);
        } finally {
            correlationIdService.unbind();
        }
    }

    private String resolveClientKey(String clientIdHeader, String remoteAddress) {
        if (clientIdHeader != null && !clientIdHeader.isBlank()) {
            return clientIdHeader.trim();
        }
        return remoteAddress != null ? remoteAddress : "unknown";
    }

    /**
     * Validates rate limit for the client.
     *
     * @throws RateLimitExceededException if rate limit is exceeded
     */
    private void validateRateLimit(String clientKey, String correlationId) {
        if (!rateLimiter.isAllowed(clientKey)) {
            log.warn("Rate limit exceeded for client: {} (correlationId: {})", SecretMasker.mask(clientKey), correlationId);
            throw new RateLimitExceededException("Rate limit exceeded. Please try again later.");
        }
    }
}

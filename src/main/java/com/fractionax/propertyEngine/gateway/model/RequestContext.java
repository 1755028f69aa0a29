package com.fractionax.propertyEngine.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request context passed through the system.
 * Contains the caller key used for rate limiting and the correlationId for tracking.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestContext {

    /**
     * Caller identity from the X-Client-ID header, or the remote address when absent.
     */
    private String clientKey;

    /**
     * Correlation ID for request tracking, echoed in the X-Correlation-Id response header.
     */
    private String correlationId;

    /**
     * Timestamp when request was received at the gateway.
     */
    private Instant receivedAt;
}

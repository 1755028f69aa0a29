package com.fractionax.propertyEngine.gateway.exception;

/**
 * Exception thrown when a client exceeds its request rate.
 */
public class RateLimitExceededException extends RuntimeException {

    public RateLimitExceededException(String message) {
        super(message);
    }
}

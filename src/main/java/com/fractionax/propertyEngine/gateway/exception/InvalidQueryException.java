package com.fractionax.propertyEngine.gateway.exception;

/**
 * Exception thrown when a search request carries neither a query nor an address.
 */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(String message) {
        super(message);
    }
}

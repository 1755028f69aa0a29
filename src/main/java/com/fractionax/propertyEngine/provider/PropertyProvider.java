package com.fractionax.propertyEngine.provider;

/**
 * Common contract of every provider adapter.
 */
public interface PropertyProvider {

    /**
     * Identifier the adapter is registered under.
     */
    ProviderId providerId();
}

package com.fractionax.propertyEngine.provider;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * External data providers the engine knows about.
 */
public enum ProviderId {

    /**
     * Spatial / property / valuation provider. OAuth2 client-credentials auth.
     */
    CORELOGIC("corelogic"),

    /**
     * Listings-search provider. Static API key auth.
     */
    ZILLOW("zillow");

    private final String id;

    ProviderId(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}

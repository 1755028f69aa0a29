package com.fractionax.propertyEngine.auth.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Client-credentials grant settings of one provider.
 */
@Value
@Builder
public class ClientCredentials {

    String tokenUrl;

    String clientId;

    @ToString.Exclude
    String clientSecret;

    public boolean isConfigured() {
        return tokenUrl != null && !tokenUrl.isBlank()
                && clientId != null && !clientId.isBlank()
                && clientSecret != null && !clientSecret.isBlank();
    }
}

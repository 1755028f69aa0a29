package com.fractionax.propertyEngine.auth.model;

import com.fractionax.propertyEngine.provider.ProviderId;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * OAuth2 access token of a provider. Owned by {@link com.fractionax.propertyEngine.auth.service.CredentialManager}.
 */
@Value
@Builder
public class ProviderToken {

    ProviderId providerId;

    @ToString.Exclude
    String accessToken;

    Instant expiresAt;

    /**
     * Whether the token may still be handed out at {@code now}: its remaining lifetime must
     * exceed the safety margin.
     */
    public boolean isFreshAt(Instant now, Duration safetyMargin) {
        return expiresAt != null && now.plus(safetyMargin).isBefore(expiresAt);
    }
}

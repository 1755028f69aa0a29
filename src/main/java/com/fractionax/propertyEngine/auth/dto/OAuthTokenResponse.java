package com.fractionax.propertyEngine.auth.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Token endpoint response of the OAuth2 client-credentials grant.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OAuthTokenResponse {

    @ToString.Exclude
    @JsonProperty("access_token")
    private String accessToken;

    /**
     * Lifetime in seconds. Some providers send it as a string; Jackson coerces it.
     */
    @JsonProperty("expires_in")
    private Long expiresIn;

    @JsonProperty("token_type")
    private String tokenType;
}

package com.fractionax.propertyEngine.auth.service;

import com.fractionax.propertyEngine.auth.dto.OAuthTokenResponse;
import com.fractionax.propertyEngine.auth.model.ClientCredentials;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

/**
 * Performs the OAuth2 client-credentials exchange against a provider token endpoint.
 */
@Slf4j
public class OAuthTokenClient {

    private final RestClient restClient;

    public OAuthTokenClient(RestClient.Builder restClientBuilder) {
        this.restClient = restClientBuilder.build();
    }

    /**
     * Requests a new access token.
     *
     * @param credentials Token URL and client id/secret (sent as HTTP Basic auth)
     * @return Token response
     * @throws org.springframework.web.client.RestClientException on HTTP or network failure
     */
    public OAuthTokenResponse requestToken(ClientCredentials credentials) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");

        log.debug("Requesting access token - tokenUrl: {}", credentials.getTokenUrl());

        return restClient.post()
                .uri(credentials.getTokenUrl())
                .headers(headers -> headers.setBasicAuth(credentials.getClientId(), credentials.getClientSecret()))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(form)
                .retrieve()
                .body(OAuthTokenResponse.class);
    }
}

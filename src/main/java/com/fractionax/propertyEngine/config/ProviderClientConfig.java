package com.fractionax.propertyEngine.config;

import com.fractionax.propertyEngine.auth.model.ClientCredentials;
import com.fractionax.propertyEngine.auth.service.CredentialManager;
import com.fractionax.propertyEngine.auth.service.OAuthTokenClient;
import com.fractionax.propertyEngine.provider.ProviderId;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP clients and credentials of the external providers.
 *
 * Every provider gets its own {@link RestClient.Builder} with connect and read timeouts.
 */
@Configuration
public class ProviderClientConfig {

    @Bean
    public RestClient.Builder coreLogicRestClientBuilder(@Value("${providers.corelogic.timeout-ms:10000}") int timeoutMs) {
        return RestClient.builder().requestFactory(requestFactory(timeoutMs));
    }

    @Bean
    public RestClient.Builder zillowRestClientBuilder(@Value("${providers.zillow.timeout-ms:10000}") int timeoutMs) {
        return RestClient.builder().requestFactory(requestFactory(timeoutMs));
    }

    @Bean
    public RestClient.Builder tokenRestClientBuilder(@Value("${providers.corelogic.timeout-ms:10000}") int timeoutMs) {
        return RestClient.builder().requestFactory(requestFactory(timeoutMs));
    }

    @Bean
    public OAuthTokenClient oAuthTokenClient(@Qualifier("tokenRestClientBuilder") RestClient.Builder builder) {
        return new OAuthTokenClient(builder);
    }

    @Bean(destroyMethod = "clear")
    public CredentialManager credentialManager(
            OAuthTokenClient tokenClient,
            Clock clock,
            @Value("${providers.corelogic.token-url:https://api-prod.corelogic.com/oauth/token}") String tokenUrl,
            @Value("${providers.corelogic.client-id:}") String clientId,
            @Value("${providers.corelogic.client-secret:}") String clientSecret,
            @Value("${providers.corelogic.token-safety-margin-seconds:30}") long safetyMarginSeconds) {

        ClientCredentials coreLogic = ClientCredentials.builder()
                .tokenUrl(tokenUrl)
                .clientId(clientId)
                .clientSecret(clientSecret)
                .build();
        return new CredentialManager(tokenClient, Map.of(ProviderId.CORELOGIC, coreLogic),
                Duration.ofSeconds(safetyMarginSeconds), clock);
    }

    private static SimpleClientHttpRequestFactory requestFactory(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return factory;
    }
}

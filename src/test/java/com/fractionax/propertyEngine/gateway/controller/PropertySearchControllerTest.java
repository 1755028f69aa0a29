package com.fractionax.propertyEngine.gateway.controller;

import com.fractionax.propertyEngine.gateway.dto.LegacySearchResponse;
import com.fractionax.propertyEngine.gateway.dto.PropertySearchResponse;
import com.fractionax.propertyEngine.gateway.exception.InvalidQueryException;
import com.fractionax.propertyEngine.gateway.exception.RateLimitExceededException;
import com.fractionax.propertyEngine.gateway.service.SearchGatewayService;
import com.fractionax.propertyEngine.orchestrator.model.CanonicalProperty;
import com.fractionax.propertyEngine.orchestrator.model.PropertyListing;
import com.fractionax.propertyEngine.verification.model.VerificationEnvelope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = {PropertySearchController.class, LegacySearchController.class})
class PropertySearchControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    SearchGatewayService gatewayService;

    private static PropertySearchResponse ok() {
        CanonicalProperty listed = CanonicalProperty.builder()
                .listing(PropertyListing.builder().listingId("27941236").priceMax(285_000L).status("FOR_SALE").build())
                .build();
        return PropertySearchResponse.builder()
                .results(List.of(listed))
                .verification(VerificationEnvelope.builder().valid(true).matchedField("location:provider").build())
                .correlationId("corr-1")
                .httpStatus(200)
                .build();
    }

    @Test
    @DisplayName("search answers 200 with the correlation id header and body")
    void search() throws Exception {
        when(gatewayService.search(any(), eq("client-9"), anyString())).thenReturn(ok());

        mvc.perform(post("/api/v2/properties/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Client-ID", "client-9")
                        .content("{\"query\":\"affordable homes in Houston\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Correlation-Id", "corr-1"))
                .andExpect(jsonPath("$.correlationId").value("corr-1"))
                .andExpect(jsonPath("$.verification.valid").value(true))
                .andExpect(jsonPath("$.results[0].listing.priceMax").value(285000))
                .andExpect(jsonPath("$.httpStatus").doesNotExist());
    }

    @Test
    @DisplayName("a resolution error is answered with its status and typed body")
    void resolutionError() throws Exception {
        PropertySearchResponse timeout = PropertySearchResponse.builder()
                .results(List.of())
                .error(new PropertySearchResponse.ErrorBody("PROVIDER_TIMEOUT", "corelogic did not respond in time", "corelogic"))
                .correlationId("corr-2")
                .httpStatus(504)
                .build();
        when(gatewayService.search(any(), isNull(), anyString())).thenReturn(timeout);

        mvc.perform(post("/api/v2/properties/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address1\":\"1600 Amphitheatre Parkway\",\"city\":\"Mountain View\",\"state\":\"CA\"}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.error.code").value("PROVIDER_TIMEOUT"))
                .andExpect(jsonPath("$.error.provider").value("corelogic"));
    }

    @Test
    @DisplayName("out-of-range coordinates are rejected before reaching the gateway")
    void validation() throws Exception {
        mvc.perform(post("/api/v2/properties/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address1\":\"1600 Amphitheatre Parkway\",\"lat\":120.0,\"lng\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("lat: lat must be between -90 and 90"));

        verifyNoInteractions(gatewayService);
    }

    @Test
    @DisplayName("malformed JSON is a 400")
    void malformedBody() throws Exception {
        mvc.perform(post("/api/v2/properties/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("an empty query is a 400 INVALID_QUERY")
    void invalidQuery() throws Exception {
        when(gatewayService.search(any(), any(), any()))
                .thenThrow(new InvalidQueryException("Provide either 'query' or 'address1'"));

        mvc.perform(post("/api/v2/properties/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_QUERY"));
    }

    @Test
    @DisplayName("rate-limited callers get 429")
    void rateLimited() throws Exception {
        when(gatewayService.search(any(), any(), any()))
                .thenThrow(new RateLimitExceededException("Rate limit exceeded. Please try again later."));

        mvc.perform(post("/api/v2/properties/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"condos in Austin\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.code").value("RATE_LIMIT_EXCEEDED"));
    }

    @Test
    @DisplayName("parcel details pass the path variable and client header through")
    void parcel() throws Exception {
        when(gatewayService.parcel(eq("1234567890"), eq("client-9"), anyString())).thenReturn(ok());

        mvc.perform(get("/api/v2/properties/1234567890").header("X-Client-ID", "client-9"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Correlation-Id", "corr-1"));

        verify(gatewayService).parcel(eq("1234567890"), eq("client-9"), anyString());
    }

    @Test
    @DisplayName("legacy search renders the legacy shape")
    void legacySearch() throws Exception {
        LegacySearchResponse legacy = LegacySearchResponse.builder()
                .fromCache(false)
                .listings(List.of(LegacySearchResponse.Listing.builder().id("27941236").price(285_000L)
                        .carouselPhotos(List.of()).dataSource("zillow").build()))
                .metadata(LegacySearchResponse.Metadata.builder()
                        .searchQuery("affordable homes in Houston").searchType("general").totalFound(1).build())
                .httpStatus(200)
                .build();
        when(gatewayService.legacySearch(any(), any(), any())).thenReturn(legacy);

        mvc.perform(post("/api/ai/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"affordable homes in Houston\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.listings[0].id").value("27941236"))
                .andExpect(jsonPath("$.metadata.searchType").value("general"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    @DisplayName("legacy search rejects a blank query")
    void legacyBlankQuery() throws Exception {
        mvc.perform(post("/api/ai/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("query: query cannot be blank"));
    }
}

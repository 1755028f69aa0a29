package com.fractionax.propertyEngine.gateway.controller;

import com.fractionax.propertyEngine.gateway.dto.PropertySearchRequest;
import com.fractionax.propertyEngine.gateway.dto.PropertySearchResponse;
import com.fractionax.propertyEngine.gateway.service.SearchGatewayService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Property search REST controller - thin HTTP layer over the resolution engine.
 *
 * Responsibilities:
 * - Handle HTTP requests/responses
 * - Extract HTTP headers
 * - Map the resolution outcome to an HTTP status
 */
@RestController
@RequestMapping("/api/v2/properties")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class PropertySearchController {

    static final String CLIENT_ID_HEADER = "X-Client-ID";
    static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    private final SearchGatewayService gatewayService;

    /**
     * Search endpoint - free text or structured address.
     *
     * @param request Search request
     * @param clientIdHeader Client id used for rate limiting (optional)
     * @return Results, verification and metadata; or an error with the matching status
     */
    @PostMapping("/search")
    public ResponseEntity<PropertySearchResponse> search(
            @Valid @RequestBody PropertySearchRequest request,
            @RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientIdHeader,
            HttpServletRequest httpRequest) {

        PropertySearchResponse response = gatewayService.search(request, clientIdHeader, httpRequest.getRemoteAddr());
        return toEntity(response);
    }

    /**
     * Parcel details endpoint - structure and valuation of a known parcel.
     */
    @GetMapping("/{parcelId}")
    public ResponseEntity<PropertySearchResponse> parcel(
            @PathVariable String parcelId,
            @RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientIdHeader,
            HttpServletRequest httpRequest) {

        PropertySearchResponse response = gatewayService.parcel(parcelId, clientIdHeader, httpRequest.getRemoteAddr());
        return toEntity(response);
    }

    private ResponseEntity<PropertySearchResponse> toEntity(PropertySearchResponse response) {
        return ResponseEntity.status(response.getHttpStatus())
                .header(CORRELATION_ID_HEADER, response.getCorrelationId())
                .body(response);
    }
}

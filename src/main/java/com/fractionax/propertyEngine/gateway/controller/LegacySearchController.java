package com.fractionax.propertyEngine.gateway.controller;

import com.fractionax.propertyEngine.gateway.dto.LegacySearchRequest;
import com.fractionax.propertyEngine.gateway.dto.LegacySearchResponse;
import com.fractionax.propertyEngine.gateway.service.SearchGatewayService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Legacy AI search endpoint, kept for existing marketplace clients.
 */
@RestController
@RequestMapping("/api/ai")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class LegacySearchController {

    private final SearchGatewayService gatewayService;

    @PostMapping("/search")
    public ResponseEntity<LegacySearchResponse> search(
            @Valid @RequestBody LegacySearchRequest request,
            @RequestHeader(value = PropertySearchController.CLIENT_ID_HEADER, required = false) String clientIdHeader,
            HttpServletRequest httpRequest) {

        LegacySearchResponse response = gatewayService.legacySearch(request, clientIdHeader, httpRequest.getRemoteAddr());
        return ResponseEntity.status(response.getHttpStatus()).body(response);
    }
}

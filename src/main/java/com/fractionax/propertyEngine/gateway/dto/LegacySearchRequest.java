package com.fractionax.propertyEngine.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO of the legacy AI search endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LegacySearchRequest {

    @NotBlank(message = "query cannot be blank")
    @Size(max = 500, message = "query must be at most 500 characters")
    private String query;
}

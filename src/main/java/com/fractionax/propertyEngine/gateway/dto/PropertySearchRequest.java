package com.fractionax.propertyEngine.gateway.dto;

import com.fractionax.propertyEngine.query.model.PropertyQuery;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for property search.
 * Either {@code query} (free text) or structured address fields.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PropertySearchRequest {

    @Size(max = 500, message = "query must be at most 500 characters")
    private String query;

    @Size(max = 200, message = "address1 must be at most 200 characters")
    private String address1;

    @Size(max = 100, message = "city must be at most 100 characters")
    private String city;

    @Size(max = 50, message = "state must be at most 50 characters")
    private String state;

    @Size(max = 10, message = "postalCode must be at most 10 characters")
    private String postalCode;

    @DecimalMin(value = "-90.0", message = "lat must be between -90 and 90")
    @DecimalMax(value = "90.0", message = "lat must be between -90 and 90")
    private Double lat;

    @DecimalMin(value = "-180.0", message = "lng must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "lng must be between -180 and 180")
    private Double lng;

    public PropertyQuery toPropertyQuery() {
        return PropertyQuery.builder()
                .rawText(query)
                .address1(address1)
                .city(city)
                .state(state)
                .postalCode(postalCode)
                .lat(lat)
                .lng(lng)
                .build();
    }
}

package com.fractionax.propertyEngine.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Coordinates {

    private Double latitude;

    private Double longitude;

    public boolean isPresent() {
        return latitude != null && longitude != null;
    }
}

package com.fractionax.propertyEngine.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PropertyStructure {

    private String propertyType;

    private Integer yearBuilt;

    private Integer squareFeet;

    private Integer bedrooms;

    private Double bathrooms;
}

package com.fractionax.propertyEngine.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fractionax.propertyEngine.orchestrator.model.CanonicalProperty;
import com.fractionax.propertyEngine.orchestrator.model.PropertyResolution;
import com.fractionax.propertyEngine.orchestrator.model.ResolutionError;
import com.fractionax.propertyEngine.orchestrator.model.ResolutionMetadata;
import com.fractionax.propertyEngine.verification.model.VerificationEnvelope;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for property search and parcel details.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PropertySearchResponse {

    private List<CanonicalProperty> results;
    private VerificationEnvelope verification;
    private ResolutionMetadata metadata;
    private ErrorBody error;
    private String correlationId;

    /**
     * HTTP status the controller answers with.
     */
    @JsonIgnore
    private int httpStatus;

    public static PropertySearchResponse from(PropertyResolution resolution, String correlationId) {
        ResolutionError error = resolution.getError();
        return PropertySearchResponse.builder()
                .results(resolution.getResults())
                .verification(resolution.getVerification())
                .metadata(resolution.getMetadata())
                .error(error == null ? null
                        : new ErrorBody(error.code().name(), error.message(),
                                error.provider() != null ? error.provider().id() : null))
                .correlationId(correlationId)
                .httpStatus(error == null ? 200 : error.code().getHttpStatus())
                .build();
    }

    public record ErrorBody(String code, String message, String provider) {}
}

package com.fractionax.propertyEngine.orchestrator.model;

import com.fractionax.propertyEngine.provider.ProviderId;

/**
 * A value reported by a provider that lost the merge for a field.
 *
 * @param field Canonical field path, e.g. "structure.bedrooms"
 * @param providerId Provider that reported the value
 * @param value The losing value
 */
public record FieldAlternate(String field, ProviderId providerId, Object value) {
}

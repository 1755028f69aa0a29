package com.fractionax.propertyEngine.cache;

import com.fractionax.propertyEngine.orchestrator.model.CanonicalProperty;
import com.fractionax.propertyEngine.orchestrator.model.ResolutionMetadata;
import com.fractionax.propertyEngine.verification.model.VerificationEnvelope;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A resolved query held by the {@link ResponseCache}.
 */
@Value
@Builder
public class CacheEntry {

    String fingerprint;

    List<CanonicalProperty> results;

    VerificationEnvelope verification;

    /**
     * Metadata as of the resolution that produced the entry ({@code fromCache=false}).
     */
    ResolutionMetadata metadata;

    Instant createdAt;

    Duration ttl;

    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt());
    }
}

package com.fractionax.propertyEngine.query.util;

import com.fractionax.propertyEngine.query.model.NormalizedQuery;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.stream.Collectors;

/**
 * Computes the cache key of a normalized query.
 */
public final class QueryFingerprint {

    private QueryFingerprint() {}

    /**
     * Hashes the sorted, lowercased identity fields of the query with SHA-256.
     *
     * @param query Normalized query
     * @return 64-character lowercase hex fingerprint
     */
    public static String of(NormalizedQuery query) {
        String canonical = query.identityFields().entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("&"));
        return sha256(canonical);
    }

    /**
     * Fingerprint of a parcel-details lookup.
     */
    public static String ofParcel(String parcelId) {
        return sha256("parcel=" + parcelId.trim().toLowerCase());
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

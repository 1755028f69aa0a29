package com.fractionax.propertyEngine.gateway.util;

/**
 * Utility class for masking client ids, API keys and tokens in logs.
 */
public class SecretMasker {

    /**
     * Shows first 2 and last 2 characters, masks the middle.
     *
     * @param value The value to mask
     * @return Masked value (e.g., "ab****yz")
     */
    public static String mask(String value) {
        if (value == null || value.length() <= 4) {
            return "****";
        }
        return value.substring(0, 2) + "****" + value.substring(value.length() - 2);
    }
}

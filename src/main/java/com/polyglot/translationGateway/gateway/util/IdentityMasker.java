package com.polyglot.translationGateway.gateway.util;

/**
 * Masks subject ids and credential fingerprints before they reach the logs.
 */
public final class IdentityMasker {

    private IdentityMasker() {
    }

    /**
     * Shows the first 2 and last 2 characters, masks the middle.
     *
     * @param value subject id or fingerprint
     * @return masked value (e.g., "ac****42"); short or null values are fully masked
     */
    public static String mask(String value) {
        if (value == null || value.length() <= 4) {
            return "****";
        }
        return value.substring(0, 2) + "****" + value.substring(value.length() - 2);
    }
}

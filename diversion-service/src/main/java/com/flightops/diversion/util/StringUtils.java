package com.flightops.diversion.util;

import java.util.Locale;

/**
 * Normalisation for airport, flight and aircraft type codes.
 */
public final class StringUtils {

    private StringUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Trimmed upper-case code, or null when blank. Case mapping is locale independent so
     * {@code "egll"} stays {@code "EGLL"} on any default locale.
     */
    public static String normalizeCode(String code) {
        if (!org.springframework.util.StringUtils.hasText(code)) {
            return null;
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }
}

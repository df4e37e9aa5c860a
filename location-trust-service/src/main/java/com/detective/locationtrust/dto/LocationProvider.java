package com.detective.locationtrust.dto;

import java.util.Locale;

/** Source of a location fix as reported by the device. */
public enum LocationProvider {
    GPS,
    NETWORK,
    PASSIVE,
    UNKNOWN;

    /**
     * Parses a provider name case-insensitively. Unrecognised or missing names map to {@link
     * #UNKNOWN}.
     */
    public static LocationProvider fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}

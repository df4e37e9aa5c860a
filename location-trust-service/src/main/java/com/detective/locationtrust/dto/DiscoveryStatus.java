package com.detective.locationtrust.dto;

/** Classified result of a discovery attempt. */
public enum DiscoveryStatus {
    DISCOVERED,
    ALREADY_DISCOVERED,
    NOT_FOUND,
    GAME_NOT_ACTIVE,
    PLAYER_MISMATCH,
    LIKELY_SPOOFED,
    INVALID_READING,
    TOO_FAR,
    LOW_CONFIDENCE,
    INTERNAL_ERROR;

    public static DiscoveryStatus fromValidationFailure(ValidationFailure failure) {
        if (failure == null) {
            return INTERNAL_ERROR;
        }
        return switch (failure) {
            case INVALID_READING -> INVALID_READING;
            case TOO_FAR -> TOO_FAR;
            case LOW_CONFIDENCE -> LOW_CONFIDENCE;
            case INTERNAL_ERROR -> INTERNAL_ERROR;
        };
    }
}

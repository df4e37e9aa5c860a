package com.detective.locationtrust.dto;

/** Why a discovery validation was rejected. */
public enum ValidationFailure {
    /** Coordinates out of range, stale or future-dated fix, implausible speed, poor accuracy. */
    INVALID_READING,
    /** Accuracy-adjusted distance exceeds the discovery radius. */
    TOO_FAR,
    /** Close enough, but the confidence score is below the acceptance threshold. */
    LOW_CONFIDENCE,
    /** Unexpected fault; the attempt was rejected rather than accepted. */
    INTERNAL_ERROR
}

package com.detective.locationtrust.dto;

import java.time.Instant;

/** Summary of how trustworthy a fix looks, for display next to the map. */
public record LocationQualityInfo(
        QualityLevel qualityLevel,
        double accuracyMeters,
        LocationProvider provider,
        Instant capturedAt,
        boolean reliable,
        double recommendedRadiusMeters) {

    public enum QualityLevel {
        EXCELLENT,
        GOOD,
        FAIR,
        POOR
    }
}

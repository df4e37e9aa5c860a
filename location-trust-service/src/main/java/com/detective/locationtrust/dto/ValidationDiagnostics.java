package com.detective.locationtrust.dto;

/**
 * Details behind a validation decision, used to build the player-facing message.
 *
 * @param rawDistanceMeters great-circle distance to the target
 * @param gpsAccuracyMeters reported horizontal accuracy
 * @param highAccuracy whether the fix is within the high-accuracy band
 * @param secondsSinceFix age of the fix at validation time
 * @param provider source of the fix
 * @param advisoryRadiusMeters "get within X m" guidance; not used for the decision
 * @param discoveryRadiusMeters the fixed radius the decision was made against
 * @param movement walking-pace check, null when no player history was consulted
 */
public record ValidationDiagnostics(
        double rawDistanceMeters,
        double gpsAccuracyMeters,
        boolean highAccuracy,
        double secondsSinceFix,
        LocationProvider provider,
        double advisoryRadiusMeters,
        double discoveryRadiusMeters,
        MovementValidation movement) {}

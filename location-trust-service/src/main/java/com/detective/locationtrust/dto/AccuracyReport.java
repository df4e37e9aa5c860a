package com.detective.locationtrust.dto;

import java.time.Instant;

/**
 * Accuracy metadata attached to a device fix.
 *
 * @param horizontalAccuracyMeters reported horizontal error radius
 * @param verticalAccuracyMeters reported vertical error, may be null
 * @param capturedAt when the device captured the fix
 * @param provider source of the fix
 */
public record AccuracyReport(
        double horizontalAccuracyMeters,
        Double verticalAccuracyMeters,
        Instant capturedAt,
        LocationProvider provider) {

    public static final double HIGH_ACCURACY_METERS = 10.0;
    public static final double ACCEPTABLE_ACCURACY_METERS = 50.0;

    public AccuracyReport {
        if (provider == null) {
            provider = LocationProvider.UNKNOWN;
        }
    }

    public static AccuracyReport of(
            double horizontalAccuracyMeters, Instant capturedAt, LocationProvider provider) {
        return new AccuracyReport(horizontalAccuracyMeters, null, capturedAt, provider);
    }

    public boolean isHighAccuracy() {
        return horizontalAccuracyMeters <= HIGH_ACCURACY_METERS;
    }

    public boolean isAcceptableAccuracy() {
        return horizontalAccuracyMeters <= ACCEPTABLE_ACCURACY_METERS;
    }
}

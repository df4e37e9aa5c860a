package com.detective.locationtrust.dto;

/**
 * A single player-submitted location fix. Lives only for the duration of one discovery attempt,
 * plus whatever time it spends in the player's recent history.
 */
public record LocationSample(
        Coordinate coordinate,
        AccuracyReport accuracy,
        Double speedMetersPerSecond,
        Double bearingDegrees,
        Double altitudeMeters) {

    public static LocationSample of(Coordinate coordinate, AccuracyReport accuracy) {
        return new LocationSample(coordinate, accuracy, null, null, null);
    }

    public LocationProvider provider() {
        return accuracy == null ? LocationProvider.UNKNOWN : accuracy.provider();
    }
}

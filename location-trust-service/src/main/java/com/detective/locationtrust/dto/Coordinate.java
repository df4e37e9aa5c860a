package com.detective.locationtrust.dto;

/**
 * A WGS84 latitude/longitude pair in decimal degrees.
 *
 * <p>The record itself accepts any value so that raw device fixes can reach {@code ReadingGuard}
 * and be rejected with a typed reason. Server-side coordinates (evidence locations) are built with
 * {@link #of(double, double)}, which enforces the ranges.
 */
public record Coordinate(double lat, double lng) {

    public static final double MIN_LATITUDE = -90.0;
    public static final double MAX_LATITUDE = 90.0;
    public static final double MIN_LONGITUDE = -180.0;
    public static final double MAX_LONGITUDE = 180.0;

    /**
     * Creates a range-checked coordinate.
     *
     * @throws IllegalArgumentException if latitude or longitude is NaN or out of range
     */
    public static Coordinate of(double lat, double lng) {
        Coordinate coordinate = new Coordinate(lat, lng);
        if (!coordinate.hasValidLatitude()) {
            throw new IllegalArgumentException("Invalid latitude value: " + lat);
        }
        if (!coordinate.hasValidLongitude()) {
            throw new IllegalArgumentException("Invalid longitude value: " + lng);
        }
        return coordinate;
    }

    public boolean hasValidLatitude() {
        return !Double.isNaN(lat) && lat >= MIN_LATITUDE && lat <= MAX_LATITUDE;
    }

    public boolean hasValidLongitude() {
        return !Double.isNaN(lng) && lng >= MIN_LONGITUDE && lng <= MAX_LONGITUDE;
    }

    public boolean isValid() {
        return hasValidLatitude() && hasValidLongitude();
    }
}

package com.detective.locationtrust.algorithm.util;

import com.detective.locationtrust.dto.Coordinate;

/**
 * Spherical-earth distance helpers.
 *
 * <p>Uses the haversine formula on the WGS84 mean radius. Accurate to well under a metre at the
 * walking distances the game cares about.
 */
public final class GeoMath {

    /** Earth's mean radius in meters. */
    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    /** Meters per degree of latitude along a meridian on the same sphere. */
    public static final double METERS_PER_DEGREE_LATITUDE = EARTH_RADIUS_METERS * Math.PI / 180.0;

    private GeoMath() {}

    /**
     * Great-circle distance between two coordinates in meters. Symmetric, and zero for identical
     * points.
     */
    public static double distance(Coordinate a, Coordinate b) {
        return distance(a.lat(), a.lng(), b.lat(), b.lng());
    }

    public static double distance(double lat1, double lng1, double lat2, double lng2) {
        double lat1Rad = Math.toRadians(lat1);
        double lat2Rad = Math.toRadians(lat2);
        double deltaLat = Math.toRadians(lat2 - lat1);
        double deltaLng = Math.toRadians(lng2 - lng1);

        double h =
                Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2)
                        + Math.cos(lat1Rad) * Math.cos(lat2Rad) * Math.sin(deltaLng / 2) * Math.sin(deltaLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));

        return EARTH_RADIUS_METERS * c;
    }
}

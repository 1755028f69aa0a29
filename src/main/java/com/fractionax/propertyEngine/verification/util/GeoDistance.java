package com.fractionax.propertyEngine.verification.util;

/**
 * Utility class for great-circle distances.
 */
public final class GeoDistance {

    private static final double EARTH_RADIUS_METERS = 6_371_000d;

    private GeoDistance() {}

    /**
     * Haversine distance between two points.
     *
     * @return Distance in meters
     */
    public static double meters(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        return 2 * EARTH_RADIUS_METERS * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }
}

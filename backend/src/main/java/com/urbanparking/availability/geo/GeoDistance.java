package com.urbanparking.availability.geo;

/**
 * Great-circle distance on a spherical earth.
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_METERS = 6_371_000d;

    /** Length of one degree of latitude, and of longitude at the equator. */
    public static final double METERS_PER_DEGREE = 111_320d;

    private GeoDistance() {
    }

    /**
     * Haversine distance between two points given in decimal degrees.
     *
     * @return distance in meters
     */
    public static double haversineMeters(double lat1, double lng1, double lat2, double lng2) {
        double lat1Rad = Math.toRadians(lat1);
        double lat2Rad = Math.toRadians(lat2);
        double deltaLat = Math.toRadians(lat2 - lat1);
        double deltaLng = Math.toRadians(lng2 - lng1);

        double sinLat = Math.sin(deltaLat / 2);
        double sinLng = Math.sin(deltaLng / 2);
        double a = sinLat * sinLat + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinLng * sinLng;
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    /**
     * Degrees of latitude spanned by a distance along a meridian, rounded up slightly so
     * that windows built from it never undershoot the true great-circle distance.
     */
    public static double metersToLatitudeDegrees(double meters) {
        return Math.toDegrees(meters / EARTH_RADIUS_METERS) * 1.0001;
    }

    /**
     * Half-width in degrees of longitude of a window that holds every point within
     * {@code meters} of a centre, for points whose latitude never exceeds
     * {@code maxAbsLatitude} in absolute value.
     */
    public static double metersToLongitudeDegrees(double meters, double maxAbsLatitude) {
        double cos = Math.cos(Math.toRadians(Math.min(90d, Math.abs(maxAbsLatitude))));
        double ratio = Math.sin(meters / (2 * EARTH_RADIUS_METERS)) / cos;
        if (cos < 1e-9 || ratio >= 1d) {
            return 360d;
        }
        return Math.toDegrees(2 * Math.asin(ratio)) * 1.0001;
    }
}

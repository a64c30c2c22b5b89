package com.logimatrix.tracking.geo;

/**
 * Great-circle helpers on a spherical earth.
 *
 * Haversine on a sphere of radius 6371 km.
 */
public final class GeoUtils {

    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    private GeoUtils() {
    }

    /**
     * Haversine distance between two coordinates.
     *
     * @return distance in meters
     */
    public static double distanceMeters(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
            * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    public static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        return distanceMeters(lat1, lon1, lat2, lon2) / 1000.0;
    }

    public static boolean isValidLatitude(Double lat) {
        return lat != null && !lat.isNaN() && lat >= -90.0 && lat <= 90.0;
    }

    public static boolean isValidLongitude(Double lon) {
        return lon != null && !lon.isNaN() && lon >= -180.0 && lon <= 180.0;
    }
}

package com.logimatrix.tracking.geo;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A WGS84 coordinate in decimal degrees.
 *
 * @param lat latitude, -90 to 90
 * @param lon longitude, -180 to 180
 */
public record GeoPoint(double lat, double lon) {

    public static GeoPoint of(double lat, double lon) {
        return new GeoPoint(lat, lon);
    }

    @JsonIgnore
    public boolean isValid() {
        return lat >= -90.0 && lat <= 90.0 && lon >= -180.0 && lon <= 180.0;
    }

    public double distanceTo(GeoPoint other) {
        return GeoUtils.distanceMeters(lat, lon, other.lat, other.lon);
    }
}

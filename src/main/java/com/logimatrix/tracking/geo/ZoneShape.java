package com.logimatrix.tracking.geo;

/**
 * Geometry of a geofence.
 *
 * Every shape exposes a bounding circle so the zone registry can index it into
 * coarse cells without knowing the concrete geometry.
 */
public interface ZoneShape {

    /**
     * Raw classification. Boundary points are inside.
     */
    boolean contains(double lat, double lon);

    /**
     * Classification given the previous state of the vehicle for this zone.
     * Shapes without hysteresis ignore the prior state.
     *
     * @param wasInside previous classification, {@code null} if unknown
     */
    default boolean classify(double lat, double lon, Boolean wasInside) {
        return contains(lat, lon);
    }

    GeoPoint boundingCenter();

    double boundingRadiusMeters();
}

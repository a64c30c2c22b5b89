package com.logimatrix.tracking.geo;

/**
 * Circular zone with optional hysteresis radii.
 *
 * With hysteresis configured, a vehicle that was outside must come within
 * {@code innerRadiusMeters} to be classified inside, and a vehicle that was inside
 * must go beyond {@code outerRadiusMeters} to be classified outside. An unknown
 * prior state uses the nominal radius.
 */
public record CircleShape(
    GeoPoint center,
    double radiusMeters,
    Double innerRadiusMeters,
    Double outerRadiusMeters
) implements ZoneShape {

    public CircleShape {
        if (center == null || !center.isValid()) {
            throw new IllegalArgumentException("Circle center must be a valid coordinate");
        }
        if (radiusMeters <= 0) {
            throw new IllegalArgumentException("Circle radius must be > 0");
        }
        if (innerRadiusMeters != null && innerRadiusMeters > radiusMeters) {
            throw new IllegalArgumentException("Inner hysteresis radius must be <= radius");
        }
        if (outerRadiusMeters != null && outerRadiusMeters < radiusMeters) {
            throw new IllegalArgumentException("Outer hysteresis radius must be >= radius");
        }
    }

    public static CircleShape of(double lat, double lon, double radiusMeters) {
        return new CircleShape(new GeoPoint(lat, lon), radiusMeters, null, null);
    }

    public double distanceFromCenter(double lat, double lon) {
        return GeoUtils.distanceMeters(center.lat(), center.lon(), lat, lon);
    }

    @Override
    public boolean contains(double lat, double lon) {
        return distanceFromCenter(lat, lon) <= radiusMeters;
    }

    @Override
    public boolean classify(double lat, double lon, Boolean wasInside) {
        double distance = distanceFromCenter(lat, lon);
        if (Boolean.TRUE.equals(wasInside) && outerRadiusMeters != null) {
            return distance <= outerRadiusMeters;
        }
        if (Boolean.FALSE.equals(wasInside) && innerRadiusMeters != null) {
            return distance <= innerRadiusMeters;
        }
        return distance <= radiusMeters;
    }

    public boolean hasHysteresis() {
        return innerRadiusMeters != null || outerRadiusMeters != null;
    }

    @Override
    public GeoPoint boundingCenter() {
        return center;
    }

    @Override
    public double boundingRadiusMeters() {
        return outerRadiusMeters != null ? outerRadiusMeters : radiusMeters;
    }
}

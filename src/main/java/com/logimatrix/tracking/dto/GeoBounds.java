package com.logimatrix.tracking.dto;

/**
 * Latitude/longitude box. A box whose west edge is east of its east edge
 * crosses the antimeridian.
 */
public record GeoBounds(double north, double south, double east, double west) {

    public GeoBounds {
        if (!(north >= -90.0 && north <= 90.0) || !(south >= -90.0 && south <= 90.0)) {
            throw new IllegalArgumentException("north and south must be within [-90, 90]");
        }
        if (!(east >= -180.0 && east <= 180.0) || !(west >= -180.0 && west <= 180.0)) {
            throw new IllegalArgumentException("east and west must be within [-180, 180]");
        }
        if (south > north) {
            throw new IllegalArgumentException("south " + south + " is above north " + north);
        }
    }

    /**
     * @return null when every edge is missing
     * @throws IllegalArgumentException if only some edges are given
     */
    public static GeoBounds ofNullable(Double north, Double south, Double east, Double west) {
        if (north == null && south == null && east == null && west == null) {
            return null;
        }
        if (north == null || south == null || east == null || west == null) {
            throw new IllegalArgumentException("bounds need north, south, east and west");
        }
        return new GeoBounds(north, south, east, west);
    }

    public boolean contains(double lat, double lon) {
        if (lat > north || lat < south) {
            return false;
        }
        if (west <= east) {
            return lon >= west && lon <= east;
        }
        return lon >= west || lon <= east;
    }
}

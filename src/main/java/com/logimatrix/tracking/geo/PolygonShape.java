package com.logimatrix.tracking.geo;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;

import java.util.ArrayList;
import java.util.List;

/**
 * Polygon zone backed by a JTS geometry.
 *
 * Containment is a planar test in lon/lat space, which is adequate for
 * city-scale fences. JTS uses (X, Y) = (longitude, latitude) order.
 * The polygon is prepared once so repeated point tests stay cheap.
 */
public final class PolygonShape implements ZoneShape {

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory(new PrecisionModel(), 4326);

    private final Polygon polygon;
    private final PreparedGeometry prepared;
    private final GeoPoint boundingCenter;
    private final double boundingRadiusMeters;

    private PolygonShape(Polygon polygon) {
        if (polygon.isEmpty() || !polygon.isValid()) {
            throw new IllegalArgumentException("Polygon ring is empty or self-intersecting");
        }
        this.polygon = polygon;
        this.prepared = PreparedGeometryFactory.prepare(polygon);

        Envelope envelope = polygon.getEnvelopeInternal();
        this.boundingCenter = new GeoPoint(
            (envelope.getMinY() + envelope.getMaxY()) / 2.0,
            (envelope.getMinX() + envelope.getMaxX()) / 2.0
        );
        double maxDistance = 0.0;
        for (Coordinate vertex : polygon.getExteriorRing().getCoordinates()) {
            maxDistance = Math.max(maxDistance,
                GeoUtils.distanceMeters(boundingCenter.lat(), boundingCenter.lon(), vertex.y, vertex.x));
        }
        this.boundingRadiusMeters = maxDistance;
    }

    /**
     * Builds a polygon from an ordered ring. The ring is closed automatically
     * if the last point differs from the first.
     */
    public static PolygonShape fromRing(List<GeoPoint> ring) {
        if (ring == null || ring.size() < 3) {
            throw new IllegalArgumentException("Polygon ring needs at least 3 points");
        }
        List<Coordinate> coordinates = new ArrayList<>(ring.size() + 1);
        for (GeoPoint point : ring) {
            if (point == null || !point.isValid()) {
                throw new IllegalArgumentException("Polygon ring contains an invalid coordinate");
            }
            coordinates.add(new Coordinate(point.lon(), point.lat()));
        }
        if (!coordinates.get(0).equals2D(coordinates.get(coordinates.size() - 1))) {
            coordinates.add(new Coordinate(coordinates.get(0)));
        }
        if (coordinates.size() < 4) {
            throw new IllegalArgumentException("Polygon ring needs at least 3 distinct points");
        }
        return new PolygonShape(GEOMETRY_FACTORY.createPolygon(coordinates.toArray(new Coordinate[0])));
    }

    /**
     * Parses a WKT polygon as stored in the geofences table.
     */
    public static PolygonShape fromWkt(String wkt) {
        try {
            Geometry geometry = new WKTReader(GEOMETRY_FACTORY).read(wkt);
            if (!(geometry instanceof Polygon polygon)) {
                throw new IllegalArgumentException("WKT is not a POLYGON: " + geometry.getGeometryType());
            }
            return new PolygonShape(polygon);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid polygon WKT", e);
        }
    }

    public String toWkt() {
        return new WKTWriter().write(polygon);
    }

    public List<GeoPoint> ring() {
        List<GeoPoint> ring = new ArrayList<>();
        for (Coordinate coordinate : polygon.getExteriorRing().getCoordinates()) {
            ring.add(new GeoPoint(coordinate.y, coordinate.x));
        }
        return ring;
    }

    @Override
    public boolean contains(double lat, double lon) {
        Point point = GEOMETRY_FACTORY.createPoint(new Coordinate(lon, lat));
        return prepared.covers(point);
    }

    @Override
    public GeoPoint boundingCenter() {
        return boundingCenter;
    }

    @Override
    public double boundingRadiusMeters() {
        return boundingRadiusMeters;
    }

    @Override
    public String toString() {
        return "PolygonShape[" + polygon.getNumPoints() + " points]";
    }
}

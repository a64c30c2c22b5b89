package com.logimatrix.tracking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.logimatrix.tracking.entity.Geofence;
import com.logimatrix.tracking.entity.GeofenceShapeType;
import com.logimatrix.tracking.geo.GeoPoint;
import com.logimatrix.tracking.geo.PolygonShape;

import java.time.Instant;
import java.util.List;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GeofenceView(
    String id,
    String tenantId,
    String name,
    GeofenceShapeType shapeType,
    GeoPoint center,
    Double radiusM,
    Double innerRadiusM,
    Double outerRadiusM,
    List<GeoPoint> polygon,
    Set<String> vehicleIds,
    Set<String> shipmentIds,
    boolean onEntry,
    boolean onExit,
    boolean active,
    Instant createdAt,
    Instant updatedAt
) {

    public static GeofenceView from(Geofence geofence) {
        boolean polygonShape = geofence.getShapeType() == GeofenceShapeType.POLYGON;
        return new GeofenceView(
            geofence.getId(),
            geofence.getTenantId(),
            geofence.getName(),
            geofence.getShapeType(),
            !polygonShape && geofence.getCenterLat() != null && geofence.getCenterLon() != null
                ? new GeoPoint(geofence.getCenterLat(), geofence.getCenterLon())
                : null,
            geofence.getRadiusM(),
            geofence.getInnerRadiusM(),
            geofence.getOuterRadiusM(),
            polygonShape && geofence.getPolygonWkt() != null ? PolygonShape.fromWkt(geofence.getPolygonWkt()).ring() : null,
            Set.copyOf(geofence.getVehicleIds()),
            Set.copyOf(geofence.getShipmentIds()),
            !Boolean.FALSE.equals(geofence.getOnEntry()),
            !Boolean.FALSE.equals(geofence.getOnExit()),
            !Boolean.FALSE.equals(geofence.getActive()),
            geofence.getCreatedAt(),
            geofence.getUpdatedAt()
        );
    }
}

package com.logimatrix.tracking.dto;

import com.logimatrix.tracking.entity.GeofenceShapeType;
import com.logimatrix.tracking.geo.GeoPoint;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Set;

/**
 * Create / update payload of a geofence.
 *
 * Circles need a center and {@code radiusM}; polygons need a ring of at least
 * three points. Triggers default to true when omitted.
 */
public record GeofenceRequest(
    @NotBlank @Size(max = 100) String tenantId,
    @NotBlank @Size(max = 255) String name,
    @NotNull GeofenceShapeType shapeType,
    @DecimalMin("-90.0") @DecimalMax("90.0") Double centerLat,
    @DecimalMin("-180.0") @DecimalMax("180.0") Double centerLon,
    @Positive Double radiusM,
    @Positive Double innerRadiusM,
    @Positive Double outerRadiusM,
    List<GeoPoint> polygon,
    Set<String> vehicleIds,
    Set<String> shipmentIds,
    Boolean onEntry,
    Boolean onExit
) {
}

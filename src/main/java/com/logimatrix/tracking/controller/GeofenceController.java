package com.logimatrix.tracking.controller;

import com.logimatrix.tracking.dto.GeofenceRequest;
import com.logimatrix.tracking.dto.GeofenceView;
import com.logimatrix.tracking.service.ZoneCatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Geofence management. Changes are visible to the ingestion path as soon as
 * the request returns.
 */
@RestController
@RequestMapping("/api/geofences")
@RequiredArgsConstructor
@Tag(name = "Geofences", description = "Tenant geofence CRUD")
public class GeofenceController {

    private final ZoneCatalogService zoneCatalogService;

    @Operation(
            summary = "Create a geofence",
            description = "Circle (center + radiusM, optional innerRadiusM/outerRadiusM hysteresis) or polygon ring. " +
                    "onEntry and onExit default to true."
    )
    @PostMapping
    public ResponseEntity<GeofenceView> create(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    required = true,
                    content = @Content(examples = @ExampleObject(
                            value = "{\"tenantId\":\"acme\",\"name\":\"Depot\",\"shapeType\":\"CIRCLE\",\"centerLat\":12.9716,\"centerLon\":77.5946,\"radiusM\":500}")))
            @Valid @RequestBody GeofenceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(zoneCatalogService.createGeofence(request));
    }

    @Operation(summary = "Replace a geofence")
    @PutMapping("/{id}")
    public ResponseEntity<GeofenceView> update(@PathVariable String id, @Valid @RequestBody GeofenceRequest request) {
        return ResponseEntity.ok(zoneCatalogService.updateGeofence(id, request));
    }

    @Operation(summary = "Get a geofence")
    @GetMapping("/{id}")
    public ResponseEntity<GeofenceView> get(@PathVariable String id) {
        return ResponseEntity.ok(zoneCatalogService.getGeofence(id));
    }

    @Operation(summary = "List the active geofences of a tenant")
    @GetMapping
    public ResponseEntity<List<GeofenceView>> list(
        @Parameter(description = "Tenant", example = "acme") @RequestParam String tenantId
    ) {
        return ResponseEntity.ok(zoneCatalogService.listGeofences(tenantId));
    }

    @Operation(summary = "Delete a geofence")
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        zoneCatalogService.deleteGeofence(id);
        return ResponseEntity.noContent().build();
    }
}

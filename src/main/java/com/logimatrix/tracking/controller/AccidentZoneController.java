package com.logimatrix.tracking.controller;

import com.logimatrix.tracking.dto.CachedAccidentZone;
import com.logimatrix.tracking.dto.NearbyAccidentZone;
import com.logimatrix.tracking.service.ZoneCatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read access to the accident zones held by the registry.
 */
@RestController
@RequestMapping("/api/accident-zones")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Accident zones", description = "Accident-prone zones used for proximity alerts")
public class AccidentZoneController {

    private final ZoneCatalogService zoneCatalogService;

    @Operation(summary = "All accident zones", description = "Heatmap source; served from the in-memory registry")
    @GetMapping
    public ResponseEntity<List<CachedAccidentZone>> all() {
        return ResponseEntity.ok(zoneCatalogService.accidentZones());
    }

    /**
     * Example: GET /api/accident-zones/nearby?lat=18.5204&lon=73.8567&radius=2000
     */
    @Operation(summary = "Accident zones within a radius, nearest first")
    @GetMapping("/nearby")
    public ResponseEntity<List<NearbyAccidentZone>> nearby(
        @Parameter(example = "18.5204") @RequestParam double lat,
        @Parameter(example = "73.8567") @RequestParam double lon,
        @Parameter(description = "Radius in meters", example = "2000") @RequestParam(defaultValue = "5000") double radius
    ) {
        return ResponseEntity.ok(zoneCatalogService.nearbyAccidentZones(lat, lon, radius));
    }

    @Operation(summary = "Reload accident zones from the database")
    @PostMapping("/refresh")
    public ResponseEntity<Map<String, Object>> refresh() {
        log.info("Manual accident zone refresh triggered");
        int count = zoneCatalogService.refreshAccidentZones();
        return ResponseEntity.ok(Map.of(
            "status", "SUCCESS",
            "accidentZones", count,
            "timestamp", Instant.now()
        ));
    }
}

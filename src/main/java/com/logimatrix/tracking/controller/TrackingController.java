package com.logimatrix.tracking.controller;

import com.logimatrix.tracking.bus.SubscriptionBus;
import com.logimatrix.tracking.dto.ActiveVehicle;
import com.logimatrix.tracking.dto.EtaEstimate;
import com.logimatrix.tracking.dto.FixRecord;
import com.logimatrix.tracking.dto.GeoBounds;
import com.logimatrix.tracking.dto.IngestionResult;
import com.logimatrix.tracking.dto.IngestionStatus;
import com.logimatrix.tracking.dto.TelemetryRecord;
import com.logimatrix.tracking.dto.TelemetryResult;
import com.logimatrix.tracking.exception.NoLocationException;
import com.logimatrix.tracking.service.ActiveVehicleService;
import com.logimatrix.tracking.service.AlertLogService;
import com.logimatrix.tracking.service.EtaService;
import com.logimatrix.tracking.service.IngestionCoordinator;
import com.logimatrix.tracking.service.PositionStore;
import com.logimatrix.tracking.service.TelemetryIngestionService;
import com.logimatrix.tracking.service.ZoneCatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * REST Controller for fix and telemetry ingestion and position queries.
 *
 * Producers that cannot keep a STOMP session open post fixes here; the
 * response carries the ingestion outcome. Dashboards read hot positions,
 * history and ETAs.
 */
@RestController
@RequestMapping("/api/tracking")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Tracking", description = "Fix ingestion, positions, history and ETA")
public class TrackingController {

    private static final Set<String> UNAVAILABLE_REASONS = Set.of(
        IngestionResult.STORE_UNAVAILABLE,
        IngestionResult.DROPPED_BY_BACKPRESSURE,
        IngestionResult.RESPONSE_TIMEOUT
    );

    private final IngestionCoordinator ingestionCoordinator;
    private final TelemetryIngestionService telemetryIngestionService;
    private final PositionStore positionStore;
    private final EtaService etaService;
    private final ZoneCatalogService zoneCatalogService;
    private final ActiveVehicleService activeVehicleService;
    private final SubscriptionBus subscriptionBus;
    private final AlertLogService alertLogService;

    /**
     * Ingest one GPS fix.
     *
     * Example request:
     * POST /api/tracking/fixes
     * {
     *   "tenantId": "acme",
     *   "vehicleId": "VH-1",
     *   "lat": 12.972,
     *   "lon": 77.595,
     *   "speed": 42.0,
     *   "ts": "2024-01-01T12:00:00Z"
     * }
     */
    @Operation(
            summary = "Ingest a GPS fix",
            description = "Validates the fix, updates the latest position and history, evaluates geofences " +
                    "and accident zones, and publishes the resulting events."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Fix accepted",
                    content = @Content(mediaType = "application/json",
                            examples = @ExampleObject(value = "{\"status\":\"accepted\",\"vehicleId\":\"VH-1\",\"ts\":\"2024-01-01T12:00:00Z\",\"geofenceAlerts\":[{\"zoneId\":\"Z\",\"zoneName\":\"Depot\",\"kind\":\"entry\"}],\"proximityAlerts\":[]}"))),
            @ApiResponse(responseCode = "200", description = "Fix not newer than the latest one, ignored"),
            @ApiResponse(responseCode = "400", description = "Fix rejected by validation"),
            @ApiResponse(responseCode = "404", description = "Vehicle unknown to the tenant"),
            @ApiResponse(responseCode = "503", description = "Position store unavailable or fix dropped")
    })
    @PostMapping("/fixes")
    public ResponseEntity<IngestionResult> ingestFix(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "GPS fix",
                    required = true,
                    content = @Content(schema = @Schema(implementation = FixRecord.class)))
            @RequestBody FixRecord fix) {
        IngestionResult result = ingestionCoordinator.ingest(fix);
        return ResponseEntity.status(statusOf(result)).body(result);
    }

    /**
     * Ingest a batch of fixes. Results are returned in request order; fixes of
     * the same vehicle are processed in request order.
     */
    @Operation(summary = "Ingest a batch of GPS fixes")
    @PostMapping("/fixes/batch")
    public ResponseEntity<List<IngestionResult>> ingestBatch(@RequestBody List<FixRecord> fixes) {
        List<CompletableFuture<IngestionResult>> futures = ingestionCoordinator.submitAll(fixes);
        List<IngestionResult> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(ingestionCoordinator.await(fixes.get(i), futures.get(i)));
        }
        return ResponseEntity.ok(results);
    }

    @Operation(
            summary = "Ingest a telemetry sample",
            description = "Stores the sample, publishes telemetry_update to the vehicle room and alarms to the " +
                    "tenant and vehicle rooms."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Sample accepted, with the alarms it raised"),
            @ApiResponse(responseCode = "400", description = "Tenant, vehicle or timestamp missing"),
            @ApiResponse(responseCode = "404", description = "Vehicle unknown to the tenant"),
            @ApiResponse(responseCode = "503", description = "Fleet directory unavailable")
    })
    @PostMapping("/telemetry")
    public ResponseEntity<TelemetryResult> ingestTelemetry(@RequestBody TelemetryRecord telemetry) {
        TelemetryResult result = telemetryIngestionService.ingest(telemetry);
        if (result.status() == IngestionStatus.REJECTED) {
            HttpStatus status = IngestionResult.UNKNOWN_VEHICLE.equals(result.reason())
                ? HttpStatus.NOT_FOUND
                : HttpStatus.SERVICE_UNAVAILABLE;
            return ResponseEntity.status(status).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Telemetry history of a vehicle, most recent first")
    @GetMapping("/vehicles/{vehicleId}/telemetry")
    public ResponseEntity<List<TelemetryRecord>> vehicleTelemetry(
        @PathVariable String vehicleId,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
        @Parameter(description = "Max samples (default 100, max 1000)", example = "100")
        @RequestParam(required = false) Integer limit
    ) {
        return ResponseEntity.ok(telemetryIngestionService.history(vehicleId, from, to, limit));
    }

    @Operation(summary = "Latest telemetry sample of a vehicle", description = "404 no_telemetry when none is stored")
    @GetMapping("/vehicles/{vehicleId}/telemetry/latest")
    public ResponseEntity<TelemetryRecord> latestTelemetry(@PathVariable String vehicleId) {
        return ResponseEntity.ok(telemetryIngestionService.latest(vehicleId));
    }

    /**
     * Active vehicles of a tenant with their latest positions.
     *
     * Example: GET /api/tracking/vehicles/active?tenantId=acme&north=13.1&south=12.8&east=77.8&west=77.4
     */
    @Operation(
            summary = "Active vehicles of a tenant",
            description = "Without bounds every active vehicle is listed, location null if not seen recently. " +
                    "With north, south, east and west only vehicles positioned inside the box are listed."
    )
    @GetMapping("/vehicles/active")
    public ResponseEntity<List<ActiveVehicle>> activeVehicles(
        @RequestParam String tenantId,
        @RequestParam(required = false) Double north,
        @RequestParam(required = false) Double south,
        @RequestParam(required = false) Double east,
        @RequestParam(required = false) Double west
    ) {
        GeoBounds bounds = GeoBounds.ofNullable(north, south, east, west);
        return ResponseEntity.ok(activeVehicleService.activeVehicles(tenantId, bounds));
    }

    @Operation(summary = "Latest position of a vehicle", description = "404 no_location when no fix arrived within the hot TTL")
    @GetMapping("/vehicles/{vehicleId}/location")
    public ResponseEntity<FixRecord> vehicleLocation(@PathVariable String vehicleId) {
        return ResponseEntity.ok(positionStore.getLatest(vehicleId)
            .orElseThrow(() -> new NoLocationException("vehicle " + vehicleId)));
    }

    @Operation(summary = "Latest position of a shipment")
    @GetMapping("/shipments/{shipmentId}/location")
    public ResponseEntity<FixRecord> shipmentLocation(@PathVariable String shipmentId) {
        return ResponseEntity.ok(positionStore.getLatestForShipment(shipmentId)
            .orElseThrow(() -> new NoLocationException("shipment " + shipmentId)));
    }

    @Operation(summary = "Track history of a vehicle, most recent first")
    @GetMapping("/vehicles/{vehicleId}/history")
    public ResponseEntity<List<FixRecord>> vehicleHistory(
        @PathVariable String vehicleId,
        @Parameter(description = "Start of the range (ISO-8601)") @RequestParam(required = false)
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
        @Parameter(description = "End of the range (ISO-8601)") @RequestParam(required = false)
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
        @Parameter(description = "Max points (default 100, max 1000)", example = "100")
        @RequestParam(required = false) Integer limit
    ) {
        return ResponseEntity.ok(positionStore.queryHistory(vehicleId, from, to, limit));
    }

    @Operation(summary = "Trail of a shipment, oldest first")
    @GetMapping("/shipments/{shipmentId}/history")
    public ResponseEntity<List<FixRecord>> shipmentHistory(
        @PathVariable String shipmentId,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
        @RequestParam(required = false) Integer limit
    ) {
        return ResponseEntity.ok(positionStore.shipmentTrail(shipmentId, from, to, limit));
    }

    @Operation(summary = "ETA of a vehicle to a destination")
    @GetMapping("/vehicles/{vehicleId}/eta")
    public ResponseEntity<EtaEstimate> vehicleEta(
        @PathVariable String vehicleId,
        @Parameter(example = "12.9716") @RequestParam double destinationLat,
        @Parameter(example = "77.5946") @RequestParam double destinationLon
    ) {
        return ResponseEntity.ok(etaService.forVehicle(vehicleId, destinationLat, destinationLon));
    }

    @Operation(summary = "ETA of a shipment to a destination")
    @GetMapping("/shipments/{shipmentId}/eta")
    public ResponseEntity<EtaEstimate> shipmentEta(
        @PathVariable String shipmentId,
        @RequestParam double destinationLat,
        @RequestParam double destinationLon
    ) {
        return ResponseEntity.ok(etaService.forShipment(shipmentId, destinationLat, destinationLon));
    }

    /**
     * Engine statistics.
     *
     * Example: GET /api/tracking/stats
     */
    @Operation(summary = "Ingestion, registry, bus and alert-log statistics")
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(Map.of(
            "ingestion", ingestionCoordinator.stats(),
            "registry", zoneCatalogService.registryStats(),
            "bus", subscriptionBus.stats(),
            "alertLog", Map.of("pendingWrites", alertLogService.pendingWriteCount()),
            "timestamp", Instant.now()
        ));
    }

    /**
     * Health check endpoint.
     *
     * Example: GET /api/tracking/health
     */
    @Operation(summary = "Liveness check")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "service", "realtime-tracking-engine",
            "timestamp", Instant.now()
        ));
    }

    static HttpStatus statusOf(IngestionResult result) {
        return switch (result.status()) {
            case ACCEPTED -> HttpStatus.ACCEPTED;
            case STALE_IGNORED -> HttpStatus.OK;
            case REJECTED -> {
                if (IngestionResult.UNKNOWN_VEHICLE.equals(result.reason())) {
                    yield HttpStatus.NOT_FOUND;
                }
                if (UNAVAILABLE_REASONS.contains(result.reason())) {
                    yield HttpStatus.SERVICE_UNAVAILABLE;
                }
                if (IngestionResult.INTERNAL_ERROR.equals(result.reason())) {
                    yield HttpStatus.INTERNAL_SERVER_ERROR;
                }
                yield HttpStatus.BAD_REQUEST;
            }
        };
    }
}

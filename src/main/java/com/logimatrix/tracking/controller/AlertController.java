package com.logimatrix.tracking.controller;

import com.logimatrix.tracking.dto.AlertAcknowledgeRequest;
import com.logimatrix.tracking.dto.AlertQuery;
import com.logimatrix.tracking.dto.AlertStats;
import com.logimatrix.tracking.dto.AlertView;
import com.logimatrix.tracking.entity.AccidentSeverity;
import com.logimatrix.tracking.entity.AlertStatus;
import com.logimatrix.tracking.entity.AlertType;
import com.logimatrix.tracking.service.AlertLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Alert log queries and lifecycle.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
@Tag(name = "Alerts", description = "Geofence and accident-proximity alert log")
public class AlertController {

    private final AlertLogService alertLogService;

    /**
     * Example: GET /api/alerts?vehicleId=VH-1&severity=high&page=0&size=50
     */
    @Operation(summary = "Query the alert log", description = "Every filter is optional; newest first")
    @GetMapping
    public ResponseEntity<Page<AlertView>> query(
        @RequestParam(required = false) String tenantId,
        @RequestParam(required = false) String vehicleId,
        @RequestParam(required = false) String driverId,
        @Parameter(description = "low, medium or high") @RequestParam(required = false) String severity,
        @Parameter(description = "geofence or accident_proximity") @RequestParam(required = false) String type,
        @Parameter(description = "active, acknowledged or resolved") @RequestParam(required = false) String status,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
        @RequestParam(required = false) Integer page,
        @RequestParam(required = false) Integer size
    ) {
        AlertQuery query = new AlertQuery(
            tenantId,
            vehicleId,
            driverId,
            AccidentSeverity.fromWire(severity),
            AlertType.fromWire(type),
            AlertStatus.fromWire(status),
            from,
            to
        );
        return ResponseEntity.ok(alertLogService.query(query, page, size));
    }

    @Operation(summary = "Currently active alerts, newest first")
    @GetMapping("/active")
    public ResponseEntity<List<AlertView>> active(
        @RequestParam(required = false) String tenantId,
        @RequestParam(required = false) Integer size
    ) {
        return ResponseEntity.ok(alertLogService.activeAlerts(tenantId, size));
    }

    @Operation(summary = "Acknowledge an alert")
    @PatchMapping("/{id}/acknowledge")
    public ResponseEntity<AlertView> acknowledge(@PathVariable UUID id, @Valid @RequestBody AlertAcknowledgeRequest request) {
        return ResponseEntity.ok(alertLogService.acknowledge(id, request.acknowledgedBy()));
    }

    @Operation(summary = "Resolve an alert")
    @PatchMapping("/{id}/resolve")
    public ResponseEntity<AlertView> resolve(@PathVariable UUID id) {
        return ResponseEntity.ok(alertLogService.resolve(id));
    }

    @Operation(summary = "Alert statistics of a vehicle", description = "Total, per-severity counts and top five zones")
    @GetMapping("/vehicles/{vehicleId}/stats")
    public ResponseEntity<AlertStats> vehicleStats(
        @PathVariable String vehicleId,
        @Parameter(example = "24") @RequestParam(defaultValue = "24") int hours
    ) {
        if (hours <= 0) {
            throw new IllegalArgumentException("hours must be > 0");
        }
        return ResponseEntity.ok(alertLogService.vehicleStats(vehicleId, hours));
    }
}

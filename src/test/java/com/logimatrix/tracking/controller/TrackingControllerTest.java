package com.logimatrix.tracking.controller;

import com.logimatrix.tracking.bus.SubscriptionBus;
import com.logimatrix.tracking.dto.ActiveVehicle;
import com.logimatrix.tracking.dto.EtaConfidence;
import com.logimatrix.tracking.dto.EtaEstimate;
import com.logimatrix.tracking.dto.FixRecord;
import com.logimatrix.tracking.dto.GeoBounds;
import com.logimatrix.tracking.dto.GeofenceEdge;
import com.logimatrix.tracking.dto.GeofenceEdgeKind;
import com.logimatrix.tracking.dto.IngestionResult;
import com.logimatrix.tracking.dto.IngestionStatus;
import com.logimatrix.tracking.dto.SpeedSource;
import com.logimatrix.tracking.dto.TelemetryRecord;
import com.logimatrix.tracking.dto.TelemetryResult;
import com.logimatrix.tracking.exception.NoLocationException;
import com.logimatrix.tracking.exception.NoTelemetryException;
import com.logimatrix.tracking.geo.GeoPoint;
import com.logimatrix.tracking.service.ActiveVehicleService;
import com.logimatrix.tracking.service.AlertLogService;
import com.logimatrix.tracking.service.EtaService;
import com.logimatrix.tracking.service.IngestionCoordinator;
import com.logimatrix.tracking.service.PositionStore;
import com.logimatrix.tracking.service.TelemetryIngestionService;
import com.logimatrix.tracking.service.ZoneCatalogService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TrackingController.class)
class TrackingControllerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IngestionCoordinator ingestionCoordinator;

    @MockBean
    private TelemetryIngestionService telemetryIngestionService;

    @MockBean
    private PositionStore positionStore;

    @MockBean
    private EtaService etaService;

    @MockBean
    private ZoneCatalogService zoneCatalogService;

    @MockBean
    private SubscriptionBus subscriptionBus;

    @MockBean
    private AlertLogService alertLogService;

    @MockBean
    private ActiveVehicleService activeVehicleService;

    @Test
    void acceptedFixReturns202WithEdges() throws Exception {
        FixRecord fix = FixRecord.of("acme", "VH-1", 12.972, 77.595, T0);
        when(ingestionCoordinator.ingest(any(FixRecord.class))).thenReturn(IngestionResult.accepted(fix,
            List.of(new GeofenceEdge("Z", "Depot", GeofenceEdgeKind.ENTRY)), List.of()));

        mockMvc.perform(post("/api/tracking/fixes")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tenantId\":\"acme\",\"vehicleId\":\"VH-1\",\"lat\":12.972,\"lon\":77.595,\"ts\":\"2024-01-01T12:00:00Z\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("accepted"))
            .andExpect(jsonPath("$.geofenceAlerts[0].zoneId").value("Z"))
            .andExpect(jsonPath("$.geofenceAlerts[0].kind").value("entry"));
    }

    @Test
    void rejectedFixCarriesTheReason() throws Exception {
        when(ingestionCoordinator.ingest(any(FixRecord.class))).thenAnswer(invocation ->
            IngestionResult.rejected(invocation.getArgument(0), IngestionResult.LATITUDE_OUT_OF_RANGE));

        mockMvc.perform(post("/api/tracking/fixes")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tenantId\":\"acme\",\"vehicleId\":\"VH-1\",\"lat\":91,\"lon\":77.595,\"ts\":\"2024-01-01T12:00:00Z\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("rejected"))
            .andExpect(jsonPath("$.reason").value("latitude_out_of_range"));
    }

    @Test
    void outcomesMapToHttpStatuses() {
        FixRecord fix = FixRecord.of("acme", "VH-1", 12.972, 77.595, T0);

        assertThat(TrackingController.statusOf(IngestionResult.stale(fix))).isEqualTo(HttpStatus.OK);
        assertThat(TrackingController.statusOf(IngestionResult.rejected(fix, IngestionResult.UNKNOWN_VEHICLE)))
            .isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(TrackingController.statusOf(IngestionResult.rejected(fix, IngestionResult.STORE_UNAVAILABLE)))
            .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(TrackingController.statusOf(IngestionResult.rejected(fix, IngestionResult.DROPPED_BY_BACKPRESSURE)))
            .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(TrackingController.statusOf(IngestionResult.rejected(fix, IngestionResult.INTERNAL_ERROR)))
            .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(TrackingController.statusOf(IngestionResult.rejected(fix, IngestionResult.TIMESTAMP_IN_FUTURE)))
            .isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void missingLocationIs404NoLocation() throws Exception {
        when(positionStore.getLatest("VH-9")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/tracking/vehicles/VH-9/location"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("no_location"));
    }

    @Test
    void latestLocationIsReturned() throws Exception {
        when(positionStore.getLatest("VH-1"))
            .thenReturn(Optional.of(FixRecord.of("acme", "VH-1", 12.972, 77.595, T0).withSpeed(42.0)));

        mockMvc.perform(get("/api/tracking/vehicles/VH-1/location"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.vehicleId").value("VH-1"))
            .andExpect(jsonPath("$.speed").value(42.0))
            .andExpect(jsonPath("$.shipmentId").doesNotExist());
    }

    @Test
    void historyPassesTheRequestedRange() throws Exception {
        when(positionStore.queryHistory(eq("VH-1"), eq(T0), isNull(), eq(10)))
            .thenReturn(List.of(FixRecord.of("acme", "VH-1", 12.972, 77.595, T0.plusSeconds(5))));

        mockMvc.perform(get("/api/tracking/vehicles/VH-1/history")
                .param("from", "2024-01-01T12:00:00Z")
                .param("limit", "10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void etaIsReturnedWithConfidence() throws Exception {
        when(etaService.forVehicle("VH-1", 12.9716, 77.5946)).thenReturn(new EtaEstimate(
            111.19, 60.0, 6671, EtaConfidence.HIGH, SpeedSource.RECENT_SAMPLES, 5,
            new GeoPoint(13.0, 78.0), new GeoPoint(12.9716, 77.5946), T0, T0.plusSeconds(6671)));

        mockMvc.perform(get("/api/tracking/vehicles/VH-1/eta")
                .param("destinationLat", "12.9716")
                .param("destinationLon", "77.5946"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.etaSeconds").value(6671))
            .andExpect(jsonPath("$.confidence").value("high"));
    }

    @Test
    void etaWithoutLocationIs404() throws Exception {
        when(etaService.forShipment("SH-1", 12.9716, 77.5946)).thenThrow(new NoLocationException("shipment SH-1"));

        mockMvc.perform(get("/api/tracking/shipments/SH-1/eta")
                .param("destinationLat", "12.9716")
                .param("destinationLon", "77.5946"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("no_location"));
    }

    @Test
    void etaRequiresADestination() throws Exception {
        mockMvc.perform(get("/api/tracking/vehicles/VH-1/eta").param("destinationLat", "12.9716"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void batchResultsKeepRequestOrder() throws Exception {
        IngestionResult first = new IngestionResult(IngestionStatus.ACCEPTED, null, "VH-1", T0, null, null);
        IngestionResult second = new IngestionResult(IngestionStatus.STALE_IGNORED, null, "VH-1", T0, null, null);
        when(ingestionCoordinator.submitAll(any())).thenReturn(List.of(
            CompletableFuture.completedFuture(first),
            CompletableFuture.completedFuture(second)));
        when(ingestionCoordinator.await(any(), any())).thenAnswer(invocation ->
            ((CompletableFuture<?>) invocation.getArgument(1)).join());

        mockMvc.perform(post("/api/tracking/fixes/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{\"tenantId\":\"acme\",\"vehicleId\":\"VH-1\",\"lat\":1,\"lon\":1,\"ts\":\"2024-01-01T12:00:00Z\"},"
                    + "{\"tenantId\":\"acme\",\"vehicleId\":\"VH-1\",\"lat\":1,\"lon\":1,\"ts\":\"2024-01-01T12:00:00Z\"}]"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].status").value("accepted"))
            .andExpect(jsonPath("$[1].status").value("stale_ignored"));
    }

    @Test
    void telemetryOfUnknownVehicleIs404() throws Exception {
        when(telemetryIngestionService.ingest(any(TelemetryRecord.class))).thenAnswer(invocation ->
            TelemetryResult.rejected(invocation.getArgument(0), IngestionResult.UNKNOWN_VEHICLE));

        mockMvc.perform(post("/api/tracking/telemetry")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tenantId\":\"acme\",\"vehicleId\":\"GHOST\",\"ts\":\"2024-01-01T12:00:00Z\",\"fuelPct\":10}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.status").value("rejected"))
            .andExpect(jsonPath("$.reason").value("unknown_vehicle"));
    }

    @Test
    void telemetryHistoryIsReturned() throws Exception {
        when(telemetryIngestionService.history(eq("VH-1"), isNull(), isNull(), eq(20))).thenReturn(List.of(
            new TelemetryRecord("acme", "VH-1", T0, null, 85.0, 40.0, 12.4, null, null, null, null)));

        mockMvc.perform(get("/api/tracking/vehicles/VH-1/telemetry").param("limit", "20"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].fuelPct").value(40.0));
    }

    @Test
    void missingTelemetryIs404NoTelemetry() throws Exception {
        when(telemetryIngestionService.latest("VH-9")).thenThrow(new NoTelemetryException("VH-9"));

        mockMvc.perform(get("/api/tracking/vehicles/VH-9/telemetry/latest"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("no_telemetry"));
    }

    @Test
    void activeVehiclesAreFilteredByBounds() throws Exception {
        GeoBounds bengaluru = new GeoBounds(13.1, 12.8, 77.8, 77.4);
        when(activeVehicleService.activeVehicles("acme", bengaluru)).thenReturn(List.of(
            new ActiveVehicle("VH-1", FixRecord.of("acme", "VH-1", 12.972, 77.595, T0))));

        mockMvc.perform(get("/api/tracking/vehicles/active")
                .param("tenantId", "acme")
                .param("north", "13.1").param("south", "12.8")
                .param("east", "77.8").param("west", "77.4"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].vehicleId").value("VH-1"))
            .andExpect(jsonPath("$[0].location.lat").value(12.972));
    }

    @Test
    void partialBoundsAreRejected() throws Exception {
        mockMvc.perform(get("/api/tracking/vehicles/active")
                .param("tenantId", "acme")
                .param("north", "13.1"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }
}

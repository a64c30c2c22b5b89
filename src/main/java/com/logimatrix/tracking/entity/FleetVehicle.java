package com.logimatrix.tracking.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read model of the vehicles registered by the fleet service. The tracking
 * engine only checks that a vehicle exists, belongs to the tenant and is active.
 */
@Entity
@Table(
    name = "fleet_vehicles",
    indexes = @Index(name = "idx_fleet_vehicle_tenant", columnList = "tenant_id")
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FleetVehicle {

    @Id
    @Column(name = "vehicle_id", length = 100)
    private String vehicleId;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(name = "plate_number", length = 50)
    private String plateNumber;

    @Column(nullable = false)
    @Builder.Default
    private Boolean active = true;
}

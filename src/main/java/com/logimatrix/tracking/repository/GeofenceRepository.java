package com.logimatrix.tracking.repository;

import com.logimatrix.tracking.entity.Geofence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GeofenceRepository extends JpaRepository<Geofence, String> {

    /**
     * Loaded into the zone registry on start-up and on every scheduled refresh.
     */
    List<Geofence> findByActiveTrue();

    List<Geofence> findByTenantIdAndActiveTrueOrderByNameAsc(String tenantId);

    long countByActiveTrue();
}

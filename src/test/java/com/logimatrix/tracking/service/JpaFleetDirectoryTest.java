package com.logimatrix.tracking.service;

import com.logimatrix.tracking.config.RedisConfig;
import com.logimatrix.tracking.repository.FleetVehicleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringJUnitConfig(JpaFleetDirectoryTest.CachingConfig.class)
class JpaFleetDirectoryTest {

    @Autowired
    private FleetDirectory fleetDirectory;

    @Autowired
    private FleetVehicleRepository fleetVehicleRepository;

    @Autowired
    private CacheManager cacheManager;

    @BeforeEach
    void setUp() {
        reset(fleetVehicleRepository);
        cacheManager.getCache(RedisConfig.FLEET_VEHICLE_CACHE).clear();
    }

    @Test
    void knownVehicleIsLookedUpOnce() {
        when(fleetVehicleRepository.existsByVehicleIdAndTenantIdAndActiveTrue("V", "acme")).thenReturn(true);

        assertThat(fleetDirectory.isKnownVehicle("acme", "V")).isTrue();
        assertThat(fleetDirectory.isKnownVehicle("acme", "V")).isTrue();

        verify(fleetVehicleRepository, times(1)).existsByVehicleIdAndTenantIdAndActiveTrue("V", "acme");
    }

    @Test
    void vehicleRegisteredAfterARejectionIsAccepted() {
        when(fleetVehicleRepository.existsByVehicleIdAndTenantIdAndActiveTrue("NEW", "acme")).thenReturn(false);
        assertThat(fleetDirectory.isKnownVehicle("acme", "NEW")).isFalse();

        clearInvocations(fleetVehicleRepository);
        when(fleetVehicleRepository.existsByVehicleIdAndTenantIdAndActiveTrue("NEW", "acme")).thenReturn(true);

        assertThat(fleetDirectory.isKnownVehicle("acme", "NEW")).isTrue();
        verify(fleetVehicleRepository).existsByVehicleIdAndTenantIdAndActiveTrue("NEW", "acme");
    }

    @Configuration
    @EnableCaching
    static class CachingConfig {

        @Bean
        FleetVehicleRepository fleetVehicleRepository() {
            return mock(FleetVehicleRepository.class);
        }

        @Bean
        CacheManager cacheManager() {
            return new ConcurrentMapCacheManager(RedisConfig.FLEET_VEHICLE_CACHE);
        }

        @Bean
        FleetDirectory fleetDirectory(FleetVehicleRepository fleetVehicleRepository) {
            return new JpaFleetDirectory(fleetVehicleRepository);
        }
    }
}

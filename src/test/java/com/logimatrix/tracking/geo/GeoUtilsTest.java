package com.logimatrix.tracking.geo;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeoUtilsTest {

    @Test
    void oneDegreeOfLongitudeAtTheEquator() {
        assertThat(GeoUtils.distanceKm(0.0, 0.0, 0.0, 1.0)).isCloseTo(111.19, within(0.01));
    }

    @Test
    void distanceIsSymmetricAndZeroForSamePoint() {
        double there = GeoUtils.distanceMeters(12.9716, 77.5946, 18.5204, 73.8567);
        double back = GeoUtils.distanceMeters(18.5204, 73.8567, 12.9716, 77.5946);

        assertThat(there).isEqualTo(back);
        assertThat(GeoUtils.distanceMeters(12.9716, 77.5946, 12.9716, 77.5946)).isZero();
    }

    @Test
    void shortDistanceInsideTheCity() {
        // Scenario point inside Shivajinagar accident zone, roughly 74 m from its center
        assertThat(GeoUtils.distanceMeters(18.5204, 73.8567, 18.5210, 73.8570)).isCloseTo(73.8, within(1.0));
    }

    @Test
    void coordinateRanges() {
        assertThat(GeoUtils.isValidLatitude(90.0)).isTrue();
        assertThat(GeoUtils.isValidLatitude(90.0001)).isFalse();
        assertThat(GeoUtils.isValidLatitude(Double.NaN)).isFalse();
        assertThat(GeoUtils.isValidLongitude(-180.0)).isTrue();
        assertThat(GeoUtils.isValidLongitude(null)).isFalse();
    }
}

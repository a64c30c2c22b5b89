package com.logimatrix.tracking.dto;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeoBoundsTest {

    @Test
    void containsPointsOnAndInsideTheEdges() {
        GeoBounds box = new GeoBounds(13.1, 12.8, 77.8, 77.4);

        assertThat(box.contains(12.972, 77.595)).isTrue();
        assertThat(box.contains(13.1, 77.4)).isTrue();
        assertThat(box.contains(13.2, 77.595)).isFalse();
        assertThat(box.contains(12.972, 77.9)).isFalse();
    }

    @Test
    void boxCrossingTheAntimeridianWraps() {
        GeoBounds fiji = new GeoBounds(-15.0, -20.0, -178.0, 176.0);

        assertThat(fiji.contains(-17.7, 178.4)).isTrue();
        assertThat(fiji.contains(-17.7, -179.0)).isTrue();
        assertThat(fiji.contains(-17.7, 170.0)).isFalse();
    }

    @Test
    void allOrNoEdges() {
        assertThat(GeoBounds.ofNullable(null, null, null, null)).isNull();
        assertThatThrownBy(() -> GeoBounds.ofNullable(13.1, null, 77.8, 77.4))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GeoBounds(12.0, 13.0, 77.8, 77.4))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

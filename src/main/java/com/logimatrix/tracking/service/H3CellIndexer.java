package com.logimatrix.tracking.service;

import com.logimatrix.tracking.config.TrackingProperties;
import com.logimatrix.tracking.geo.GeoPoint;
import com.uber.h3core.H3Core;
import com.uber.h3core.LengthUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Coarse H3 tiling used by the zone registry as a spatial pre-filter.
 *
 * A zone is indexed into every cell of a k-ring around the cell of its bounding
 * center, with k large enough to cover the bounding radius plus one ring of
 * slack. A fix looks up its own cell and the ring around it. Any zone that can
 * contain the fix shares at least one cell with that lookup set.
 */
@Component
@Slf4j
public class H3CellIndexer {

    private final H3Core h3;
    private final int resolution;
    private final int maxRing;
    private final double edgeLengthMeters;

    public H3CellIndexer(H3Core h3, TrackingProperties properties) {
        this.h3 = h3;
        this.resolution = properties.getRegistry().getH3Resolution();
        this.maxRing = properties.getRegistry().getMaxIndexRing();
        this.edgeLengthMeters = h3.getHexagonEdgeLengthAvg(resolution, LengthUnit.m);
        log.info("Zone index uses H3 resolution {} (avg edge {} m, max ring {})",
            resolution, Math.round(edgeLengthMeters), maxRing);
    }

    public long cellOf(double lat, double lon) {
        return h3.latLngToCell(lat, lon, resolution);
    }

    /**
     * Cells to probe for a fix: its own cell and the immediate ring.
     */
    public List<Long> lookupCells(double lat, double lon) {
        return h3.gridDisk(cellOf(lat, lon), 1);
    }

    /**
     * Cells covering a bounding circle.
     *
     * @return empty when the circle needs a wider ring than allowed; such zones
     *         are kept in an always-checked list instead
     */
    public Optional<List<Long>> coverCells(GeoPoint center, double radiusMeters) {
        int k = ringFor(radiusMeters);
        if (k > maxRing) {
            return Optional.empty();
        }
        return Optional.of(h3.gridDisk(cellOf(center.lat(), center.lon()), k));
    }

    int ringFor(double radiusMeters) {
        return (int) Math.ceil(radiusMeters / edgeLengthMeters) + 1;
    }

    public int getResolution() {
        return resolution;
    }
}

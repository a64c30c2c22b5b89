package com.logimatrix.tracking.dto;

import java.util.List;
import java.util.Set;

/**
 * Result of evaluating one fix against the tenant's geofences.
 *
 * @param currentMemberships zones the vehicle is inside after this fix
 * @param edges              entry / exit transitions, ordered by zone id
 * @param deferred           true when the fix was too inaccurate to classify
 */
public record GeofenceEvaluation(Set<String> currentMemberships, List<GeofenceEdge> edges, boolean deferred) {

    public GeofenceEvaluation {
        currentMemberships = Set.copyOf(currentMemberships);
        edges = List.copyOf(edges);
    }

    public static GeofenceEvaluation deferred(Set<String> currentMemberships) {
        return new GeofenceEvaluation(currentMemberships, List.of(), true);
    }
}

package com.logimatrix.tracking.dto;

import java.util.List;

/**
 * Result of evaluating one fix against the accident zones.
 *
 * @param activation  the new active alert, null if none
 * @param resolutions active states that returned to idle on this fix
 * @param skipped     true if the zone set was too stale to evaluate
 */
public record ProximityEvaluation(ProximityActivation activation, List<ProximityResolution> resolutions, boolean skipped) {

    public ProximityEvaluation {
        resolutions = resolutions == null ? List.of() : List.copyOf(resolutions);
    }

    public static ProximityEvaluation skippedEvaluation() {
        return new ProximityEvaluation(null, List.of(), true);
    }

    public List<ProximityActivation> activations() {
        return activation == null ? List.of() : List.of(activation);
    }
}

package com.logimatrix.tracking.dto;

import java.time.Instant;

/**
 * An active accident-proximity state returned to idle.
 *
 * @param activatedAt fix timestamp of the original activation
 * @param resolvedTs  fix timestamp that triggered the resolution
 * @param reason      exit_hold or active_max
 */
public record ProximityResolution(String zoneId, Instant activatedAt, Instant resolvedTs, String reason) {

    public static final String EXIT_HOLD = "exit_hold";
    public static final String ACTIVE_MAX = "active_max";
}

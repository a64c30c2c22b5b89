package com.logimatrix.tracking.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where the speed behind an ETA came from.
 */
public enum SpeedSource {
    /** Weighted mean of recent track samples. */
    RECENT_SAMPLES,
    /** Speed reported with the latest fix. */
    LAST_KNOWN,
    /** Configured fallback speed. */
    DEFAULT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

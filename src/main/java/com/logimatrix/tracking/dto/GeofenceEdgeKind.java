package com.logimatrix.tracking.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GeofenceEdgeKind {
    ENTRY,
    EXIT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

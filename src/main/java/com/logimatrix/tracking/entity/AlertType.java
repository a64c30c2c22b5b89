package com.logimatrix.tracking.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertType {
    GEOFENCE,
    ACCIDENT_PROXIMITY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertType fromWire(String value) {
        return value == null ? null : AlertType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package com.logimatrix.tracking.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a logged alert: active until an operator acknowledges it or it is
 * resolved (by an operator, or by the accident engine when the vehicle leaves).
 */
public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertStatus fromWire(String value) {
        return value == null ? null : AlertStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

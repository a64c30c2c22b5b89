package com.logimatrix.tracking.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of an accident-prone zone. Disjoint from alert status.
 */
public enum AccidentSeverity {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int rank;

    AccidentSeverity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AccidentSeverity fromWire(String value) {
        return value == null ? null : AccidentSeverity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package com.logimatrix.tracking.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlarmLevel {
    INFO,
    WARNING,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

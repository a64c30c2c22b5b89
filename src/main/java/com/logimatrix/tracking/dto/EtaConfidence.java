package com.logimatrix.tracking.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EtaConfidence {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

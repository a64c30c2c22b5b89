package com.logimatrix.tracking.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IngestionStatus {
    ACCEPTED("accepted"),
    STALE_IGNORED("stale_ignored"),
    REJECTED("rejected");

    private final String wireName;

    IngestionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

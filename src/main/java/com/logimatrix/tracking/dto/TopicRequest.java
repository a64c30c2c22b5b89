package com.logimatrix.tracking.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * STOMP join / leave payload, e.g. {"topic": "vehicle:VH-1"}.
 */
public record TopicRequest(
    @NotBlank(message = "Topic is required")
    String topic
) {
}

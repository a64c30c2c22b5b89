package com.logimatrix.tracking.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AlertAcknowledgeRequest(
    @NotBlank(message = "acknowledgedBy is required")
    @Size(max = 100)
    String acknowledgedBy
) {
}

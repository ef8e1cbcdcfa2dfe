package com.linlay.agentstream.model.api;

import jakarta.validation.constraints.NotBlank;

public record QueryRequest(
        @NotBlank String message
) {
}

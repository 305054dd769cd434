package com.seatplanner.backend.modules.layout.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record PositionRequest(
        @NotNull(message = "x is required") Double x,
        @NotNull(message = "y is required") Double y
) {
}

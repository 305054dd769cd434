package com.seatplanner.backend.modules.layout.presentation.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateIconRequest(
        @NotBlank(message = "iconType is required") @Size(max = 64) String iconType,
        @NotNull(message = "x is required") Double x,
        @NotNull(message = "y is required") Double y,
        @Min(1) Integer size,
        Double rotation
) {
}

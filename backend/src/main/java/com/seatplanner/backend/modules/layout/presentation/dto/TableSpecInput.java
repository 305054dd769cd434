package com.seatplanner.backend.modules.layout.presentation.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record TableSpecInput(
        @NotBlank(message = "name is required") @Size(max = 100) String name,
        @NotNull(message = "capacity is required") @Min(value = 1, message = "capacity must be at least 1") Integer capacity,
        String shape,
        String purpose,
        String color,
        @Min(1) Integer seatSides,
        String seatSidesConfig,
        Boolean showSeats
) {
}

package com.seatplanner.backend.modules.event.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record EventRequest(
        @NotBlank(message = "name is required") @Size(max = 200) String name,
        @NotNull(message = "date is required") LocalDate date,
        @Size(max = 200) String venue,
        LocalTime startTime,
        LocalTime endTime
) {
}

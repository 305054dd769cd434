package com.seatplanner.backend.modules.event.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventResponse(
        Long id,
        String name,
        LocalDate date,
        String venue,
        LocalTime startTime,
        LocalTime endTime,
        String layoutImage,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}

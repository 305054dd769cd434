package com.seatplanner.backend.modules.layout.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TableResponse(
        Long id,
        Long eventId,
        String name,
        int capacity,
        double positionX,
        double positionY,
        String shape,
        String purpose,
        String color,
        Integer width,
        Integer height,
        double rotation,
        int seatSides,
        String seatSidesConfig,
        boolean showSeats,
        Long partyCount,
        Long seatsOccupied
) {
}

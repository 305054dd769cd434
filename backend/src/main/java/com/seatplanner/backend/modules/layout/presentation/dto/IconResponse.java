package com.seatplanner.backend.modules.layout.presentation.dto;

public record IconResponse(
        Long id,
        Long eventId,
        String iconType,
        double positionX,
        double positionY,
        int size,
        double rotation
) {
}

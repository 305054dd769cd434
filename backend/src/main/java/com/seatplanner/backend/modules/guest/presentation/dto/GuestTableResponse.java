package com.seatplanner.backend.modules.guest.presentation.dto;

public record GuestTableResponse(
        Long id,
        String name,
        int capacity,
        double positionX,
        double positionY
) {
}

package com.seatplanner.backend.modules.event.presentation.dto;

public record EventStatsResponse(
        long tableCount,
        long totalCapacity,
        long assignedGuests,
        long partyCount,
        long remainingSeats
) {
}

package com.seatplanner.backend.modules.seating.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SeatAssignmentResponse(
        Long id,
        Long tableId,
        int seatNumber,
        Long partyId,
        Integer memberIndex,
        String partyName,
        Integer partySize
) {
}

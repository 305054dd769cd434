package com.seatplanner.backend.modules.seating.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record ClaimSeatRequest(
        @NotNull Integer seatNumber,
        @NotNull Long partyId,
        Integer memberIndex
) {
}

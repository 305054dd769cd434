package com.seatplanner.backend.modules.seating.presentation.dto;

import com.seatplanner.backend.modules.party.domain.Party;
import com.seatplanner.backend.modules.seating.domain.SeatAssignment;

public final class SeatingDtoMapper {

    private SeatingDtoMapper() {
    }

    public static SeatAssignmentResponse toResponse(SeatAssignment seat) {
        Party party = seat.getParty();
        return new SeatAssignmentResponse(
                seat.getId(),
                seat.getTable().getId(),
                seat.getSeatNumber(),
                party != null ? party.getId() : null,
                party != null ? seat.getMemberIndex() : null,
                party != null ? party.getName() : null,
                party != null ? party.getPartySize() : null
        );
    }
}

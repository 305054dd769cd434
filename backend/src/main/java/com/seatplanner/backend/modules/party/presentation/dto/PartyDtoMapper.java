package com.seatplanner.backend.modules.party.presentation.dto;

import java.util.List;

import com.seatplanner.backend.modules.layout.domain.VenueTable;
import com.seatplanner.backend.modules.party.domain.Party;

public final class PartyDtoMapper {

    private PartyDtoMapper() {
    }

    public static PartyResponse toResponse(Party party, List<Integer> seatedMembers) {
        VenueTable table = party.getTable();
        return new PartyResponse(
                party.getId(),
                party.getEvent().getId(),
                party.getName(),
                party.getEmail(),
                party.getPhone(),
                party.getGroupName(),
                party.getPartySize(),
                party.getToken(),
                table != null ? table.getId() : null,
                table != null ? table.getTableName() : null,
                table != null ? table.getCapacity() : null,
                seatedMembers != null ? List.copyOf(seatedMembers) : List.of()
        );
    }
}

package com.seatplanner.backend.modules.guest.presentation.dto;

import com.seatplanner.backend.modules.event.domain.SeatingEvent;
import com.seatplanner.backend.modules.layout.domain.VenueTable;
import com.seatplanner.backend.modules.party.domain.Party;

public final class GuestDtoMapper {

    private GuestDtoMapper() {
    }

    public static GuestViewResponse toViewResponse(Party party) {
        VenueTable table = party.getTable();
        SeatingEvent event = party.getEvent();
        return new GuestViewResponse(
                party.getId(),
                party.getName(),
                party.getEmail(),
                party.getPhone(),
                party.getGroupName(),
                party.getPartySize(),
                table != null ? table.getId() : null,
                table != null ? table.getTableName() : null,
                table != null ? table.getCapacity() : null,
                table != null ? table.getPositionX() : null,
                table != null ? table.getPositionY() : null,
                event.getId(),
                event.getName(),
                event.getEventDate(),
                event.getVenue()
        );
    }

    public static GuestTableResponse toTableResponse(VenueTable table) {
        return new GuestTableResponse(
                table.getId(),
                table.getTableName(),
                table.getCapacity(),
                table.getPositionX(),
                table.getPositionY()
        );
    }
}

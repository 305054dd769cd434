package com.seatplanner.backend.modules.event.presentation.dto;

import com.seatplanner.backend.modules.event.domain.SeatingEvent;
import com.seatplanner.backend.modules.occupancy.domain.EventOccupancy;

public final class EventDtoMapper {

    private EventDtoMapper() {
    }

    public static EventResponse toResponse(SeatingEvent event) {
        return new EventResponse(
                event.getId(),
                event.getName(),
                event.getEventDate(),
                event.getVenue(),
                event.getStartTime(),
                event.getEndTime(),
                event.getLayoutImage(),
                event.getCreatedAt(),
                event.getUpdatedAt()
        );
    }

    public static EventDetailResponse toDetailResponse(SeatingEvent event, EventOccupancy occupancy) {
        EventStatsResponse stats = new EventStatsResponse(
                occupancy.tableCount(),
                occupancy.totalCapacity(),
                occupancy.assignedGuests(),
                occupancy.partyCount(),
                occupancy.remainingSeats()
        );
        return new EventDetailResponse(toResponse(event), stats);
    }
}

package com.seatplanner.backend.modules.guest.presentation.dto;

import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What a guest sees for their own invitation. Table fields are absent while the party is unassigned.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GuestViewResponse(
        Long id,
        String name,
        String email,
        String phone,
        String groupName,
        int partySize,
        Long tableId,
        String tableName,
        Integer tableCapacity,
        Double positionX,
        Double positionY,
        Long eventId,
        String eventName,
        LocalDate eventDate,
        String eventVenue
) {
}

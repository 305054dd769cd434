package com.seatplanner.backend.modules.party.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PartyResponse(
        Long id,
        Long eventId,
        String name,
        String email,
        String phone,
        String groupName,
        int partySize,
        String token,
        Long tableId,
        String tableName,
        Integer tableCapacity,
        List<Integer> seatedMembers
) {
}

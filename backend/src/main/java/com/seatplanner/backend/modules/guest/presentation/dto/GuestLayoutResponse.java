package com.seatplanner.backend.modules.guest.presentation.dto;

import java.util.List;

public record GuestLayoutResponse(
        List<GuestTableResponse> tables,
        Long callerTableId
) {
}

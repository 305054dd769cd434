package com.seatplanner.backend.modules.event.presentation.dto;

public record EventDetailResponse(EventResponse event, EventStatsResponse stats) {
}

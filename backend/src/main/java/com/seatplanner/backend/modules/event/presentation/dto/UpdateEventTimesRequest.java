package com.seatplanner.backend.modules.event.presentation.dto;

import java.time.LocalTime;

public record UpdateEventTimesRequest(LocalTime startTime, LocalTime endTime) {
}

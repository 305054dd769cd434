package com.seatplanner.backend.modules.occupancy.domain;

public record TableOccupancy(long partyCount, long seatsOccupied) {

    public static final TableOccupancy EMPTY = new TableOccupancy(0, 0);
}

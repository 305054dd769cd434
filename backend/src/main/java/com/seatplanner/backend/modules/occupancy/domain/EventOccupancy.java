package com.seatplanner.backend.modules.occupancy.domain;

/**
 * Seat totals of one event. Capacity is advisory, so {@link #remainingSeats()} goes negative when
 * more guests are assigned than there are seats.
 */
public record EventOccupancy(long tableCount, long totalCapacity, long assignedGuests, long partyCount) {

    public static final EventOccupancy EMPTY = new EventOccupancy(0, 0, 0, 0);

    public long remainingSeats() {
        return totalCapacity - assignedGuests;
    }
}

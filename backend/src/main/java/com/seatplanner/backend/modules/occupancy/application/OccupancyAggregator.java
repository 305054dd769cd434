package com.seatplanner.backend.modules.occupancy.application;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.seatplanner.backend.modules.layout.infrastructure.persistence.VenueTableRepository;
import com.seatplanner.backend.modules.occupancy.domain.EventOccupancy;
import com.seatplanner.backend.modules.occupancy.domain.TableOccupancy;
import com.seatplanner.backend.modules.party.infrastructure.persistence.PartyRepository;
import com.seatplanner.backend.modules.seating.infrastructure.persistence.SeatAssignmentRepository;

/**
 * Read-only counters derived from tables, parties and seat claims. Nothing here is stored;
 * every call recomputes from the current rows.
 */
@Component
@Transactional(readOnly = true)
public class OccupancyAggregator {

    private final VenueTableRepository venueTableRepository;
    private final PartyRepository partyRepository;
    private final SeatAssignmentRepository seatAssignmentRepository;

    public OccupancyAggregator(
            VenueTableRepository venueTableRepository,
            PartyRepository partyRepository,
            SeatAssignmentRepository seatAssignmentRepository
    ) {
        this.venueTableRepository = venueTableRepository;
        this.partyRepository = partyRepository;
        this.seatAssignmentRepository = seatAssignmentRepository;
    }

    public EventOccupancy summarizeEvent(Long eventId) {
        VenueTableRepository.CapacitySummaryProjection capacity = venueTableRepository.summarizeCapacity(eventId);
        PartyRepository.PartySummaryProjection parties = partyRepository.summarizeParties(eventId);
        if (capacity == null && parties == null) {
            return EventOccupancy.EMPTY;
        }
        return new EventOccupancy(
                capacity != null ? capacity.getTableCount() : 0,
                capacity != null ? capacity.getTotalCapacity() : 0,
                parties != null ? parties.getAssignedGuests() : 0,
                parties != null ? parties.getPartyCount() : 0
        );
    }

    /**
     * Occupancy keyed by table id. Tables without any assigned party are absent from the map.
     */
    public Map<Long, TableOccupancy> summarizeTables(Long eventId) {
        Map<Long, TableOccupancy> result = new HashMap<>();
        for (PartyRepository.TableOccupancyProjection row : partyRepository.summarizeTableOccupancy(eventId)) {
            result.put(row.getTableId(), new TableOccupancy(row.getPartyCount(), row.getSeatsOccupied()));
        }
        return result;
    }

    /**
     * Member indices currently holding a seat, per party id, ascending.
     */
    public Map<Long, List<Integer>> seatedMembers(Long eventId) {
        Map<Long, List<Integer>> result = new HashMap<>();
        for (SeatAssignmentRepository.SeatedMemberProjection row
                : seatAssignmentRepository.findSeatedMembersOfEvent(eventId)) {
            result.computeIfAbsent(row.getPartyId(), key -> new ArrayList<>()).add(row.getMemberIndex());
        }
        return result;
    }
}

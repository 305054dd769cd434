package com.seatplanner.backend.modules.seating.application;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.seatplanner.backend.global.error.InvalidRequestException;
import com.seatplanner.backend.global.error.ResourceConflictException;
import com.seatplanner.backend.global.error.ResourceNotFoundException;
import com.seatplanner.backend.modules.layout.domain.VenueTable;
import com.seatplanner.backend.modules.layout.infrastructure.persistence.VenueTableRepository;
import com.seatplanner.backend.modules.party.domain.Party;
import com.seatplanner.backend.modules.party.infrastructure.persistence.PartyRepository;
import com.seatplanner.backend.modules.seating.domain.SeatAssignment;
import com.seatplanner.backend.modules.seating.infrastructure.persistence.SeatAssignmentRepository;
import com.seatplanner.backend.modules.seating.presentation.dto.ClaimSeatRequest;
import com.seatplanner.backend.modules.seating.presentation.dto.SeatAssignmentResponse;
import com.seatplanner.backend.modules.seating.presentation.dto.SeatingDtoMapper;

/**
 * Per-seat claims at a table. A seat holds at most one party member and a member holds at most one seat.
 */
@Service
@Transactional
public class SeatAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(SeatAssignmentService.class);

    private final VenueTableRepository venueTableRepository;
    private final PartyRepository partyRepository;
    private final SeatAssignmentRepository seatAssignmentRepository;

    public SeatAssignmentService(
            VenueTableRepository venueTableRepository,
            PartyRepository partyRepository,
            SeatAssignmentRepository seatAssignmentRepository
    ) {
        this.venueTableRepository = venueTableRepository;
        this.partyRepository = partyRepository;
        this.seatAssignmentRepository = seatAssignmentRepository;
    }

    /**
     * Puts a party member on a seat, replacing whoever held it. The member's previous seat, at this
     * or any other table, is released.
     */
    public SeatAssignmentResponse claimSeat(Long tableId, ClaimSeatRequest request) {
        VenueTable table = loadTable(tableId);
        if (request == null || request.seatNumber() == null || request.seatNumber() < 1) {
            throw new InvalidRequestException("INVALID_SEAT_NUMBER", "Seat number must be at least 1");
        }
        if (request.partyId() == null) {
            throw new InvalidRequestException("PARTY_REQUIRED", "partyId is required");
        }
        Party party = partyRepository.findWithEventById(request.partyId())
                .orElseThrow(() -> new ResourceNotFoundException("party", request.partyId()));
        Long eventId = table.getEvent().getId();
        if (!party.belongsTo(eventId)) {
            throw new InvalidRequestException("PARTY_NOT_IN_EVENT",
                    "Party %d does not belong to event %d".formatted(party.getId(), eventId));
        }
        int memberIndex = request.memberIndex() != null ? request.memberIndex() : 1;
        if (memberIndex < 1 || memberIndex > party.getPartySize()) {
            throw new InvalidRequestException("MEMBER_INDEX_OUT_OF_RANGE",
                    "memberIndex must be between 1 and %d".formatted(party.getPartySize()));
        }

        int seatNumber = request.seatNumber();
        int replaced = seatAssignmentRepository.deleteSeat(tableId, seatNumber);
        int moved = seatAssignmentRepository.deleteMemberSeat(party.getId(), memberIndex);

        SeatAssignment saved;
        try {
            saved = seatAssignmentRepository.saveAndFlush(new SeatAssignment(table, seatNumber, party, memberIndex));
        } catch (DataIntegrityViolationException ex) {
            if (isSeatTakenViolation(ex)) {
                throw new ResourceConflictException("SEAT_TAKEN",
                        "Seat %d at table %d was claimed concurrently".formatted(seatNumber, tableId), ex);
            }
            throw ex;
        }
        log.info("Seat {} at table {} claimed by party {} member {} (replaced={}, moved={})",
                seatNumber, tableId, party.getId(), memberIndex, replaced, moved);
        return SeatingDtoMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<SeatAssignmentResponse> listSeats(Long tableId) {
        ensureTableExists(tableId);
        return seatAssignmentRepository.findByTableIdWithParty(tableId).stream()
                .map(SeatingDtoMapper::toResponse)
                .toList();
    }

    /**
     * Releasing a free seat is not an error.
     */
    public void releaseSeat(Long tableId, int seatNumber) {
        ensureTableExists(tableId);
        int released = seatAssignmentRepository.deleteSeat(tableId, seatNumber);
        if (released > 0) {
            log.info("Released seat {} at table {}", seatNumber, tableId);
        }
    }

    private boolean isSeatTakenViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(SeatAssignment.TABLE_SEAT_CONSTRAINT);
    }

    private VenueTable loadTable(Long tableId) {
        return venueTableRepository.findWithEventById(tableId)
                .orElseThrow(() -> new ResourceNotFoundException("table", tableId));
    }

    private void ensureTableExists(Long tableId) {
        if (!venueTableRepository.existsById(tableId)) {
            throw new ResourceNotFoundException("table", tableId);
        }
    }
}

package com.seatplanner.backend.modules.party.application;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.seatplanner.backend.global.error.InvalidRequestException;
import com.seatplanner.backend.global.error.ResourceConflictException;
import com.seatplanner.backend.global.error.ResourceNotFoundException;
import com.seatplanner.backend.modules.event.domain.SeatingEvent;
import com.seatplanner.backend.modules.event.infrastructure.persistence.SeatingEventRepository;
import com.seatplanner.backend.modules.layout.domain.VenueTable;
import com.seatplanner.backend.modules.layout.infrastructure.persistence.VenueTableRepository;
import com.seatplanner.backend.modules.occupancy.application.OccupancyAggregator;
import com.seatplanner.backend.modules.party.domain.Party;
import com.seatplanner.backend.modules.party.infrastructure.persistence.PartyRepository;
import com.seatplanner.backend.modules.party.presentation.dto.CreatePartyRequest;
import com.seatplanner.backend.modules.party.presentation.dto.PartyDtoMapper;
import com.seatplanner.backend.modules.party.presentation.dto.PartyResponse;
import com.seatplanner.backend.modules.party.presentation.dto.UpdatePartyRequest;
import com.seatplanner.backend.modules.seating.infrastructure.persistence.SeatAssignmentRepository;

@Service
@Transactional
public class PartyService {

    private static final Logger log = LoggerFactory.getLogger(PartyService.class);
    private static final int MAX_TOKEN_ATTEMPTS = 5;

    private final SeatingEventRepository seatingEventRepository;
    private final VenueTableRepository venueTableRepository;
    private final PartyRepository partyRepository;
    private final SeatAssignmentRepository seatAssignmentRepository;
    private final OccupancyAggregator occupancyAggregator;
    private final GuestTokenGenerator guestTokenGenerator;

    public PartyService(
            SeatingEventRepository seatingEventRepository,
            VenueTableRepository venueTableRepository,
            PartyRepository partyRepository,
            SeatAssignmentRepository seatAssignmentRepository,
            OccupancyAggregator occupancyAggregator,
            GuestTokenGenerator guestTokenGenerator
    ) {
        this.seatingEventRepository = seatingEventRepository;
        this.venueTableRepository = venueTableRepository;
        this.partyRepository = partyRepository;
        this.seatAssignmentRepository = seatAssignmentRepository;
        this.occupancyAggregator = occupancyAggregator;
        this.guestTokenGenerator = guestTokenGenerator;
    }

    public PartyResponse addParty(Long eventId, CreatePartyRequest request) {
        if (request == null || !StringUtils.hasText(request.name())) {
            throw new InvalidRequestException("PARTY_NAME_REQUIRED", "Party name is required");
        }
        int partySize = resolvePartySize(request.partySize());
        SeatingEvent event = seatingEventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("event", eventId));
        VenueTable table = request.tableId() != null ? loadTableOfEvent(request.tableId(), eventId) : null;

        Party party = new Party(event, issueToken());
        party.setName(request.name().trim());
        party.setEmail(trimToNull(request.email()));
        party.setPhone(trimToNull(request.phone()));
        party.setGroupName(trimToNull(request.groupName()));
        party.setPartySize(partySize);
        party.setTable(table);

        Party saved = saveNewParty(party);
        log.info("Added party id={} to event {} (size={}, table={})",
                saved.getId(), eventId, partySize, table != null ? table.getId() : null);
        return PartyDtoMapper.toResponse(saved, List.of());
    }

    @Transactional(readOnly = true)
    public List<PartyResponse> listParties(Long eventId) {
        if (!seatingEventRepository.existsById(eventId)) {
            throw new ResourceNotFoundException("event", eventId);
        }
        Map<Long, List<Integer>> seated = occupancyAggregator.seatedMembers(eventId);
        return partyRepository.findByEventIdWithTable(eventId).stream()
                .map(party -> PartyDtoMapper.toResponse(party, seated.getOrDefault(party.getId(), List.of())))
                .toList();
    }

    /**
     * Shrinking the party releases the seats of members beyond the new size.
     */
    public PartyResponse updateParty(Long partyId, UpdatePartyRequest request) {
        if (request == null || !StringUtils.hasText(request.name())) {
            throw new InvalidRequestException("PARTY_NAME_REQUIRED", "Party name is required");
        }
        int partySize = resolvePartySize(request.partySize());
        Party party = loadParty(partyId);

        if (partySize < party.getPartySize()) {
            int released = seatAssignmentRepository.deleteMemberSeatsBeyond(partyId, partySize);
            if (released > 0) {
                log.info("Released {} seats of party {} after size change {} -> {}",
                        released, partyId, party.getPartySize(), partySize);
            }
        }
        party.setName(request.name().trim());
        party.setEmail(trimToNull(request.email()));
        party.setPhone(trimToNull(request.phone()));
        party.setGroupName(trimToNull(request.groupName()));
        party.setPartySize(partySize);

        Party saved = partyRepository.saveAndFlush(party);
        return PartyDtoMapper.toResponse(saved, seatedMembersOf(saved));
    }

    /**
     * Moves the party to another table of its event, or unassigns it when {@code tableId} is null.
     * Seats the party still holds at any other table are released.
     */
    public PartyResponse reassignParty(Long partyId, Long tableId) {
        Party party = loadParty(partyId);
        Long eventId = party.getEvent().getId();

        int released;
        if (tableId == null) {
            released = seatAssignmentRepository.deletePartySeats(partyId);
            party.setTable(null);
        } else {
            VenueTable table = loadTableOfEvent(tableId, eventId);
            released = seatAssignmentRepository.deletePartySeatsOutside(partyId, tableId);
            party.setTable(table);
        }
        Party saved = partyRepository.saveAndFlush(party);
        log.info("Reassigned party {} to table {} (releasedSeats={})", partyId, tableId, released);
        return PartyDtoMapper.toResponse(saved, seatedMembersOf(saved));
    }

    /**
     * Seat rows held by the party stay in place with their party reference cleared.
     */
    public void deleteParty(Long partyId) {
        Party party = loadParty(partyId);
        int detached = seatAssignmentRepository.detachParty(partyId);
        partyRepository.delete(party);
        log.info("Deleted party {} from event {} (detachedSeats={})", partyId, party.getEvent().getId(), detached);
    }

    private List<Integer> seatedMembersOf(Party party) {
        return occupancyAggregator.seatedMembers(party.getEvent().getId())
                .getOrDefault(party.getId(), List.of());
    }

    /**
     * The existence check in {@link #issueToken()} can race with another insert; the unique
     * constraint decides.
     */
    private Party saveNewParty(Party party) {
        try {
            return partyRepository.save(party);
        } catch (DataIntegrityViolationException ex) {
            if (isTokenViolation(ex)) {
                log.warn("Guest token collided on insert for event {}", party.getEvent().getId());
                throw new ResourceConflictException("DUPLICATE_GUEST_TOKEN",
                        "Could not issue a unique guest token, retry the request", ex);
            }
            throw ex;
        }
    }

    private boolean isTokenViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(Party.TOKEN_CONSTRAINT);
    }

    private String issueToken() {
        for (int attempt = 0; attempt < MAX_TOKEN_ATTEMPTS; attempt++) {
            String token = guestTokenGenerator.nextToken();
            if (!partyRepository.existsByToken(token)) {
                return token;
            }
        }
        throw new IllegalStateException("Could not issue a unique guest token");
    }

    private Party loadParty(Long partyId) {
        return partyRepository.findWithEventById(partyId)
                .orElseThrow(() -> new ResourceNotFoundException("party", partyId));
    }

    private VenueTable loadTableOfEvent(Long tableId, Long eventId) {
        VenueTable table = venueTableRepository.findWithEventById(tableId)
                .orElseThrow(() -> new ResourceNotFoundException("table", tableId));
        if (!table.belongsTo(eventId)) {
            throw new InvalidRequestException("TABLE_NOT_IN_EVENT",
                    "Table %d does not belong to event %d".formatted(tableId, eventId));
        }
        return table;
    }

    private static int resolvePartySize(Integer requested) {
        if (requested == null) {
            return 1;
        }
        if (requested < 1) {
            throw new InvalidRequestException("INVALID_PARTY_SIZE", "Party size must be at least 1");
        }
        return requested;
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}

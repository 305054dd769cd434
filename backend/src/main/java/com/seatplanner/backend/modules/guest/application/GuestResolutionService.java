package com.seatplanner.backend.modules.guest.application;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.seatplanner.backend.global.error.ResourceNotFoundException;
import com.seatplanner.backend.modules.guest.presentation.dto.GuestDtoMapper;
import com.seatplanner.backend.modules.guest.presentation.dto.GuestLayoutResponse;
import com.seatplanner.backend.modules.guest.presentation.dto.GuestTableResponse;
import com.seatplanner.backend.modules.guest.presentation.dto.GuestViewResponse;
import com.seatplanner.backend.modules.layout.infrastructure.persistence.VenueTableRepository;
import com.seatplanner.backend.modules.party.domain.Party;
import com.seatplanner.backend.modules.party.infrastructure.persistence.PartyRepository;

/**
 * Read-only lookups keyed by a guest token. Nothing returned here names another party.
 */
@Service
@Transactional(readOnly = true)
public class GuestResolutionService {

    private static final Logger log = LoggerFactory.getLogger(GuestResolutionService.class);

    private final PartyRepository partyRepository;
    private final VenueTableRepository venueTableRepository;

    public GuestResolutionService(PartyRepository partyRepository, VenueTableRepository venueTableRepository) {
        this.partyRepository = partyRepository;
        this.venueTableRepository = venueTableRepository;
    }

    public GuestViewResponse resolveGuest(String token) {
        return GuestDtoMapper.toViewResponse(loadParty(token));
    }

    public GuestLayoutResponse resolveLayout(String token) {
        Party party = loadParty(token);
        List<GuestTableResponse> tables = venueTableRepository
                .findByEventIdOrderByTableNameAsc(party.getEvent().getId()).stream()
                .map(GuestDtoMapper::toTableResponse)
                .toList();
        Long callerTableId = party.getTable() != null ? party.getTable().getId() : null;
        return new GuestLayoutResponse(tables, callerTableId);
    }

    private Party loadParty(String token) {
        return partyRepository.findByToken(token)
                .orElseThrow(() -> {
                    log.debug("Unknown guest token {}", mask(token));
                    return new ResourceNotFoundException("guest", mask(token));
                });
    }

    static String mask(String token) {
        if (token == null || token.length() <= 4) {
            return "****";
        }
        return token.substring(0, 4) + "****";
    }
}

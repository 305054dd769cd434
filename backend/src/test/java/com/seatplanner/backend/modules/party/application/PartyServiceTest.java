package com.seatplanner.backend.modules.party.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import com.seatplanner.backend.global.error.InvalidRequestException;
import com.seatplanner.backend.global.error.ResourceConflictException;
import com.seatplanner.backend.modules.event.domain.SeatingEvent;
import com.seatplanner.backend.modules.event.infrastructure.persistence.SeatingEventRepository;
import com.seatplanner.backend.modules.layout.domain.VenueTable;
import com.seatplanner.backend.modules.layout.infrastructure.persistence.VenueTableRepository;
import com.seatplanner.backend.modules.occupancy.application.OccupancyAggregator;
import com.seatplanner.backend.modules.party.domain.Party;
import com.seatplanner.backend.modules.party.infrastructure.persistence.PartyRepository;
import com.seatplanner.backend.modules.party.presentation.dto.CreatePartyRequest;
import com.seatplanner.backend.modules.party.presentation.dto.PartyResponse;
import com.seatplanner.backend.modules.party.presentation.dto.UpdatePartyRequest;
import com.seatplanner.backend.modules.seating.infrastructure.persistence.SeatAssignmentRepository;
import com.seatplanner.backend.support.TestEntities;

@ExtendWith(MockitoExtension.class)
class PartyServiceTest {

    @Mock
    private SeatingEventRepository seatingEventRepository;

    @Mock
    private VenueTableRepository venueTableRepository;

    @Mock
    private PartyRepository partyRepository;

    @Mock
    private SeatAssignmentRepository seatAssignmentRepository;

    @Mock
    private OccupancyAggregator occupancyAggregator;

    @Mock
    private GuestTokenGenerator guestTokenGenerator;

    @InjectMocks
    private PartyService partyService;

    private SeatingEvent event;
    private VenueTable table;

    @BeforeEach
    void setUp() {
        event = TestEntities.event(1L, "Spring Gala");
        table = TestEntities.table(5L, event, "A1", 8);
    }

    @Test
    @DisplayName("a new party gets a fresh token and defaults to one member")
    void addPartyIssuesToken() {
        when(seatingEventRepository.findById(1L)).thenReturn(Optional.of(event));
        when(guestTokenGenerator.nextToken()).thenReturn("tok-1");
        when(partyRepository.existsByToken("tok-1")).thenReturn(false);
        when(partyRepository.save(any(Party.class))).thenAnswer(invocation -> invocation.getArgument(0));

        PartyResponse response = partyService.addParty(1L,
                new CreatePartyRequest("  Lee Family ", null, null, null, null, null));

        assertThat(response.name()).isEqualTo("Lee Family");
        assertThat(response.partySize()).isEqualTo(1);
        assertThat(response.token()).isEqualTo("tok-1");
        assertThat(response.tableId()).isNull();
        assertThat(response.seatedMembers()).isEmpty();
    }

    @Test
    void tokenCollisionDrawsAnotherToken() {
        when(seatingEventRepository.findById(1L)).thenReturn(Optional.of(event));
        when(guestTokenGenerator.nextToken()).thenReturn("taken", "fresh");
        when(partyRepository.existsByToken("taken")).thenReturn(true);
        when(partyRepository.existsByToken("fresh")).thenReturn(false);
        when(partyRepository.save(any(Party.class))).thenAnswer(invocation -> invocation.getArgument(0));

        PartyResponse response = partyService.addParty(1L,
                new CreatePartyRequest("Kim", null, null, null, 2, null));

        assertThat(response.token()).isEqualTo("fresh");
    }

    @Test
    @DisplayName("a token taken by a concurrent insert surfaces as a conflict")
    void tokenViolationOnInsertIsConflict() {
        when(seatingEventRepository.findById(1L)).thenReturn(Optional.of(event));
        when(guestTokenGenerator.nextToken()).thenReturn("tok-1");
        when(partyRepository.existsByToken("tok-1")).thenReturn(false);
        when(partyRepository.save(any(Party.class))).thenThrow(new DataIntegrityViolationException(
                "duplicate key value violates unique constraint \"uq_party_token\""));

        assertThatThrownBy(() -> partyService.addParty(1L,
                new CreatePartyRequest("Kim", null, null, null, 1, null)))
                .isInstanceOf(ResourceConflictException.class)
                .hasFieldOrPropertyWithValue("code", "DUPLICATE_GUEST_TOKEN");
    }

    @Test
    void otherIntegrityViolationsPropagate() {
        when(seatingEventRepository.findById(1L)).thenReturn(Optional.of(event));
        when(guestTokenGenerator.nextToken()).thenReturn("tok-1");
        when(partyRepository.existsByToken("tok-1")).thenReturn(false);
        when(partyRepository.save(any(Party.class))).thenThrow(new DataIntegrityViolationException(
                "new row violates check constraint \"ck_party_size\""));

        assertThatThrownBy(() -> partyService.addParty(1L,
                new CreatePartyRequest("Kim", null, null, null, 1, null)))
                .isExactlyInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("a table of another event cannot be assigned on creation")
    void addPartyRejectsForeignTable() {
        VenueTable foreign = TestEntities.table(6L, TestEntities.event(2L, "Other"), "B1", 4);
        when(seatingEventRepository.findById(1L)).thenReturn(Optional.of(event));
        when(venueTableRepository.findWithEventById(6L)).thenReturn(Optional.of(foreign));

        assertThatThrownBy(() -> partyService.addParty(1L,
                new CreatePartyRequest("Kim", null, null, null, 2, 6L)))
                .isInstanceOf(InvalidRequestException.class)
                .hasFieldOrPropertyWithValue("code", "TABLE_NOT_IN_EVENT");
        verify(partyRepository, never()).save(any());
    }

    @Test
    void blankNameIsRejected() {
        assertThatThrownBy(() -> partyService.addParty(1L,
                new CreatePartyRequest("   ", null, null, null, 1, null)))
                .isInstanceOf(InvalidRequestException.class)
                .hasFieldOrPropertyWithValue("code", "PARTY_NAME_REQUIRED");
    }

    @Test
    @DisplayName("shrinking a party releases seats of members beyond the new size")
    void shrinkingReleasesSeats() {
        Party party = TestEntities.party(7L, event, "Lee Family", 4);
        when(partyRepository.findWithEventById(7L)).thenReturn(Optional.of(party));
        when(seatAssignmentRepository.deleteMemberSeatsBeyond(7L, 2)).thenReturn(1);
        when(partyRepository.saveAndFlush(party)).thenReturn(party);
        when(occupancyAggregator.seatedMembers(1L)).thenReturn(Map.of(7L, List.of(1, 2)));

        PartyResponse response = partyService.updateParty(7L,
                new UpdatePartyRequest("Lee Family", null, null, null, 2));

        assertThat(response.partySize()).isEqualTo(2);
        assertThat(response.seatedMembers()).containsExactly(1, 2);
        verify(seatAssignmentRepository).deleteMemberSeatsBeyond(7L, 2);
    }

    @Test
    void growingKeepsSeats() {
        Party party = TestEntities.party(7L, event, "Lee Family", 2);
        when(partyRepository.findWithEventById(7L)).thenReturn(Optional.of(party));
        when(partyRepository.saveAndFlush(party)).thenReturn(party);
        when(occupancyAggregator.seatedMembers(1L)).thenReturn(Map.of());

        partyService.updateParty(7L, new UpdatePartyRequest("Lee Family", null, null, null, 5));

        verify(seatAssignmentRepository, never()).deleteMemberSeatsBeyond(anyLong(), anyInt());
    }

    @Test
    @DisplayName("moving a party releases its seats at other tables")
    void reassignReleasesSeatsElsewhere() {
        Party party = TestEntities.party(7L, event, "Lee Family", 2);
        when(partyRepository.findWithEventById(7L)).thenReturn(Optional.of(party));
        when(venueTableRepository.findWithEventById(5L)).thenReturn(Optional.of(table));
        when(partyRepository.saveAndFlush(party)).thenReturn(party);
        when(occupancyAggregator.seatedMembers(1L)).thenReturn(Map.of());

        PartyResponse response = partyService.reassignParty(7L, 5L);

        assertThat(response.tableId()).isEqualTo(5L);
        assertThat(response.tableName()).isEqualTo("A1");
        verify(seatAssignmentRepository).deletePartySeatsOutside(7L, 5L);
        verify(seatAssignmentRepository, never()).deletePartySeats(anyLong());
    }

    @Test
    void unassignReleasesAllSeats() {
        Party party = TestEntities.party(7L, event, "Lee Family", 2);
        party.setTable(table);
        when(partyRepository.findWithEventById(7L)).thenReturn(Optional.of(party));
        when(partyRepository.saveAndFlush(party)).thenReturn(party);
        when(occupancyAggregator.seatedMembers(1L)).thenReturn(Map.of());

        PartyResponse response = partyService.reassignParty(7L, null);

        assertThat(response.tableId()).isNull();
        verify(seatAssignmentRepository).deletePartySeats(7L);
    }

    @Test
    @DisplayName("deleting a party detaches its seat rows before removing it")
    void deleteDetachesSeats() {
        Party party = TestEntities.party(7L, event, "Lee Family", 2);
        when(partyRepository.findWithEventById(7L)).thenReturn(Optional.of(party));

        partyService.deleteParty(7L);

        InOrder order = inOrder(seatAssignmentRepository, partyRepository);
        order.verify(seatAssignmentRepository).detachParty(7L);
        order.verify(partyRepository).delete(party);
    }
}

package com.seatplanner.backend.modules.seating.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

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
import com.seatplanner.backend.global.error.ResourceNotFoundException;
import com.seatplanner.backend.modules.event.domain.SeatingEvent;
import com.seatplanner.backend.modules.layout.domain.VenueTable;
import com.seatplanner.backend.modules.layout.infrastructure.persistence.VenueTableRepository;
import com.seatplanner.backend.modules.party.domain.Party;
import com.seatplanner.backend.modules.party.infrastructure.persistence.PartyRepository;
import com.seatplanner.backend.modules.seating.domain.SeatAssignment;
import com.seatplanner.backend.modules.seating.infrastructure.persistence.SeatAssignmentRepository;
import com.seatplanner.backend.modules.seating.presentation.dto.ClaimSeatRequest;
import com.seatplanner.backend.modules.seating.presentation.dto.SeatAssignmentResponse;
import com.seatplanner.backend.support.TestEntities;

@ExtendWith(MockitoExtension.class)
class SeatAssignmentServiceTest {

    @Mock
    private VenueTableRepository venueTableRepository;

    @Mock
    private PartyRepository partyRepository;

    @Mock
    private SeatAssignmentRepository seatAssignmentRepository;

    @InjectMocks
    private SeatAssignmentService seatAssignmentService;

    private SeatingEvent event;
    private VenueTable table;
    private Party party;

    @BeforeEach
    void setUp() {
        event = TestEntities.event(1L, "Spring Gala");
        table = TestEntities.table(10L, event, "A1", 8);
        party = TestEntities.party(20L, event, "Lee Family", 4);
    }

    @Test
    @DisplayName("claiming a seat clears its holder and the member's previous seat before inserting")
    void claimSeatReplacesHolder() {
        when(venueTableRepository.findWithEventById(10L)).thenReturn(Optional.of(table));
        when(partyRepository.findWithEventById(20L)).thenReturn(Optional.of(party));
        when(seatAssignmentRepository.saveAndFlush(any(SeatAssignment.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        SeatAssignmentResponse response = seatAssignmentService.claimSeat(10L, new ClaimSeatRequest(1, 20L, 2));

        assertThat(response.tableId()).isEqualTo(10L);
        assertThat(response.seatNumber()).isEqualTo(1);
        assertThat(response.partyId()).isEqualTo(20L);
        assertThat(response.memberIndex()).isEqualTo(2);
        assertThat(response.partyName()).isEqualTo("Lee Family");
        assertThat(response.partySize()).isEqualTo(4);

        InOrder order = inOrder(seatAssignmentRepository);
        order.verify(seatAssignmentRepository).deleteSeat(10L, 1);
        order.verify(seatAssignmentRepository).deleteMemberSeat(20L, 2);
        order.verify(seatAssignmentRepository).saveAndFlush(any(SeatAssignment.class));
    }

    @Test
    void memberIndexDefaultsToFirstMember() {
        when(venueTableRepository.findWithEventById(10L)).thenReturn(Optional.of(table));
        when(partyRepository.findWithEventById(20L)).thenReturn(Optional.of(party));
        when(seatAssignmentRepository.saveAndFlush(any(SeatAssignment.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        SeatAssignmentResponse response = seatAssignmentService.claimSeat(10L, new ClaimSeatRequest(3, 20L, null));

        assertThat(response.memberIndex()).isEqualTo(1);
        verify(seatAssignmentRepository).deleteMemberSeat(20L, 1);
    }

    @Test
    void memberIndexBeyondPartySizeIsRejected() {
        when(venueTableRepository.findWithEventById(10L)).thenReturn(Optional.of(table));
        when(partyRepository.findWithEventById(20L)).thenReturn(Optional.of(party));

        assertThatThrownBy(() -> seatAssignmentService.claimSeat(10L, new ClaimSeatRequest(1, 20L, 5)))
                .isInstanceOf(InvalidRequestException.class)
                .hasFieldOrPropertyWithValue("code", "MEMBER_INDEX_OUT_OF_RANGE");
        verify(seatAssignmentRepository, never()).saveAndFlush(any());
    }

    @Test
    void seatNumberMustBePositive() {
        when(venueTableRepository.findWithEventById(10L)).thenReturn(Optional.of(table));

        assertThatThrownBy(() -> seatAssignmentService.claimSeat(10L, new ClaimSeatRequest(0, 20L, 1)))
                .isInstanceOf(InvalidRequestException.class)
                .hasFieldOrPropertyWithValue("code", "INVALID_SEAT_NUMBER");
    }

    @Test
    @DisplayName("a party of another event cannot claim the seat")
    void partyOfOtherEventIsRejected() {
        Party stranger = TestEntities.party(30L, TestEntities.event(2L, "Other"), "Kim", 1);
        when(venueTableRepository.findWithEventById(10L)).thenReturn(Optional.of(table));
        when(partyRepository.findWithEventById(30L)).thenReturn(Optional.of(stranger));

        assertThatThrownBy(() -> seatAssignmentService.claimSeat(10L, new ClaimSeatRequest(1, 30L, 1)))
                .isInstanceOf(InvalidRequestException.class)
                .hasFieldOrPropertyWithValue("code", "PARTY_NOT_IN_EVENT");
        verify(seatAssignmentRepository, never()).deleteSeat(anyLong(), anyInt());
    }

    @Test
    void unknownTableOrPartyIsNotFound() {
        when(venueTableRepository.findWithEventById(99L)).thenReturn(Optional.empty());
        assertThatThrownBy(() -> seatAssignmentService.claimSeat(99L, new ClaimSeatRequest(1, 20L, 1)))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasFieldOrPropertyWithValue("code", "TABLE_NOT_FOUND");

        when(venueTableRepository.findWithEventById(10L)).thenReturn(Optional.of(table));
        when(partyRepository.findWithEventById(98L)).thenReturn(Optional.empty());
        assertThatThrownBy(() -> seatAssignmentService.claimSeat(10L, new ClaimSeatRequest(1, 98L, 1)))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasFieldOrPropertyWithValue("code", "PARTY_NOT_FOUND");
    }

    @Test
    @DisplayName("a concurrent insert on the same seat surfaces as a conflict")
    void concurrentClaimIsConflict() {
        when(venueTableRepository.findWithEventById(10L)).thenReturn(Optional.of(table));
        when(partyRepository.findWithEventById(20L)).thenReturn(Optional.of(party));
        when(seatAssignmentRepository.saveAndFlush(any(SeatAssignment.class)))
                .thenThrow(new DataIntegrityViolationException(
                        "duplicate key value violates unique constraint \"uq_seat_assignment_table_seat\""));

        assertThatThrownBy(() -> seatAssignmentService.claimSeat(10L, new ClaimSeatRequest(1, 20L, 1)))
                .isInstanceOf(ResourceConflictException.class)
                .hasFieldOrPropertyWithValue("code", "SEAT_TAKEN");
    }

    @Test
    void releasingFreeSeatIsNoOp() {
        when(venueTableRepository.existsById(10L)).thenReturn(true);
        when(seatAssignmentRepository.deleteSeat(10L, 4)).thenReturn(0);

        seatAssignmentService.releaseSeat(10L, 4);

        verify(seatAssignmentRepository).deleteSeat(10L, 4);
    }
}

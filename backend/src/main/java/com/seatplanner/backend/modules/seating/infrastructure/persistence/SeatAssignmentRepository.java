package com.seatplanner.backend.modules.seating.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.seatplanner.backend.modules.seating.domain.SeatAssignment;

public interface SeatAssignmentRepository extends JpaRepository<SeatAssignment, Long> {

    @Query("""
            select s from SeatAssignment s
              left join fetch s.party
             where s.table.id = :tableId
             order by s.seatNumber asc
            """)
    List<SeatAssignment> findByTableIdWithParty(@Param("tableId") Long tableId);

    @Query("""
            select s.party.id as partyId, s.memberIndex as memberIndex
              from SeatAssignment s
             where s.party.event.id = :eventId
               and s.memberIndex is not null
             order by s.party.id asc, s.memberIndex asc
            """)
    List<SeatedMemberProjection> findSeatedMembersOfEvent(@Param("eventId") Long eventId);

    @Modifying
    @Query("delete from SeatAssignment s where s.table.id = :tableId and s.seatNumber = :seatNumber")
    int deleteSeat(@Param("tableId") Long tableId, @Param("seatNumber") int seatNumber);

    @Modifying
    @Query("delete from SeatAssignment s where s.party.id = :partyId and s.memberIndex = :memberIndex")
    int deleteMemberSeat(@Param("partyId") Long partyId, @Param("memberIndex") int memberIndex);

    @Modifying
    @Query("delete from SeatAssignment s where s.party.id = :partyId and s.memberIndex > :partySize")
    int deleteMemberSeatsBeyond(@Param("partyId") Long partyId, @Param("partySize") int partySize);

    @Modifying
    @Query("delete from SeatAssignment s where s.party.id = :partyId and s.table.id <> :tableId")
    int deletePartySeatsOutside(@Param("partyId") Long partyId, @Param("tableId") Long tableId);

    @Modifying
    @Query("delete from SeatAssignment s where s.party.id = :partyId")
    int deletePartySeats(@Param("partyId") Long partyId);

    @Modifying
    @Query("delete from SeatAssignment s where s.table.id = :tableId")
    int deleteAllOfTable(@Param("tableId") Long tableId);

    @Modifying
    @Query("""
            delete from SeatAssignment s
             where s.table.id in (select t.id from VenueTable t where t.event.id = :eventId)
            """)
    int deleteAllOfEventTables(@Param("eventId") Long eventId);

    @Modifying
    @Query("update SeatAssignment s set s.party = null where s.party.id = :partyId")
    int detachParty(@Param("partyId") Long partyId);

    @Modifying
    @Query("""
            update SeatAssignment s set s.party = null
             where s.party.id in (select p.id from Party p where p.event.id = :eventId)
            """)
    int detachPartiesOfEvent(@Param("eventId") Long eventId);

    interface SeatedMemberProjection {

        Long getPartyId();

        Integer getMemberIndex();
    }
}

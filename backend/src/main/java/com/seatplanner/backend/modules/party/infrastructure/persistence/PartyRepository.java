package com.seatplanner.backend.modules.party.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.seatplanner.backend.modules.party.domain.Party;

public interface PartyRepository extends JpaRepository<Party, Long> {

    @Query("""
            select p from Party p
              left join fetch p.table
             where p.event.id = :eventId
             order by p.name asc, p.id asc
            """)
    List<Party> findByEventIdWithTable(@Param("eventId") Long eventId);

    @Query("select p from Party p join fetch p.event left join fetch p.table where p.id = :id")
    Optional<Party> findWithEventById(@Param("id") Long id);

    @Query("select p from Party p join fetch p.event left join fetch p.table where p.token = :token")
    Optional<Party> findByToken(@Param("token") String token);

    boolean existsByToken(String token);

    @Query("""
            select count(p) as partyCount,
                   coalesce(sum(case when p.table is not null then p.partySize else 0 end), 0) as assignedGuests
              from Party p
             where p.event.id = :eventId
            """)
    PartySummaryProjection summarizeParties(@Param("eventId") Long eventId);

    @Query("""
            select p.table.id as tableId,
                   count(p) as partyCount,
                   coalesce(sum(p.partySize), 0) as seatsOccupied
              from Party p
             where p.event.id = :eventId
               and p.table is not null
             group by p.table.id
            """)
    List<TableOccupancyProjection> summarizeTableOccupancy(@Param("eventId") Long eventId);

    @Modifying
    @Query("update Party p set p.table = null where p.table.id = :tableId")
    int detachFromTable(@Param("tableId") Long tableId);

    @Modifying
    @Query("""
            update Party p set p.table = null
             where p.table.id in (select t.id from VenueTable t where t.event.id = :eventId)
            """)
    int detachFromTablesOfEvent(@Param("eventId") Long eventId);

    @Modifying
    @Query("delete from Party p where p.event.id = :eventId")
    int deleteAllOfEvent(@Param("eventId") Long eventId);

    interface PartySummaryProjection {

        long getPartyCount();

        long getAssignedGuests();
    }

    interface TableOccupancyProjection {

        Long getTableId();

        long getPartyCount();

        long getSeatsOccupied();
    }
}

package com.seatplanner.backend.modules.layout.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.seatplanner.backend.modules.layout.domain.VenueTable;

public interface VenueTableRepository extends JpaRepository<VenueTable, Long> {

    List<VenueTable> findByEventIdOrderByTableNameAsc(Long eventId);

    @Query("select t from VenueTable t join fetch t.event where t.id = :id")
    Optional<VenueTable> findWithEventById(@Param("id") Long id);

    boolean existsByEventIdAndTableNameAndIdNot(Long eventId, String tableName, Long id);

    @Query("""
            select t.tableName
              from VenueTable t
             where t.event.id = :eventId
               and t.tableName in :names
            """)
    List<String> findExistingNames(@Param("eventId") Long eventId, @Param("names") Collection<String> names);

    @Query("""
            select count(t) as tableCount,
                   coalesce(sum(t.capacity), 0) as totalCapacity
              from VenueTable t
             where t.event.id = :eventId
            """)
    CapacitySummaryProjection summarizeCapacity(@Param("eventId") Long eventId);

    @Modifying
    @Query("delete from VenueTable t where t.event.id = :eventId")
    int deleteAllOfEvent(@Param("eventId") Long eventId);

    interface CapacitySummaryProjection {

        long getTableCount();

        long getTotalCapacity();
    }
}

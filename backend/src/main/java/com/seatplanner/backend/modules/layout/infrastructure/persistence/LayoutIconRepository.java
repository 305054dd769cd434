package com.seatplanner.backend.modules.layout.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.seatplanner.backend.modules.layout.domain.LayoutIcon;

public interface LayoutIconRepository extends JpaRepository<LayoutIcon, Long> {

    List<LayoutIcon> findByEventIdOrderByIdAsc(Long eventId);

    @Modifying
    @Query("delete from LayoutIcon i where i.event.id = :eventId")
    int deleteAllOfEvent(@Param("eventId") Long eventId);
}

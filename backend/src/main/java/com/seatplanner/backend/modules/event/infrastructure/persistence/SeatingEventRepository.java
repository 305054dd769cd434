package com.seatplanner.backend.modules.event.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.seatplanner.backend.modules.event.domain.SeatingEvent;

public interface SeatingEventRepository extends JpaRepository<SeatingEvent, Long> {

    List<SeatingEvent> findAllByOrderByEventDateDescIdDesc();
}

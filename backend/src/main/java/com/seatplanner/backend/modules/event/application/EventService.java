package com.seatplanner.backend.modules.event.application;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.seatplanner.backend.global.config.SeatingProperties;
import com.seatplanner.backend.global.error.InvalidRequestException;
import com.seatplanner.backend.global.error.ResourceNotFoundException;
import com.seatplanner.backend.modules.event.domain.SeatingEvent;
import com.seatplanner.backend.modules.event.infrastructure.persistence.SeatingEventRepository;
import com.seatplanner.backend.modules.event.presentation.dto.EventDetailResponse;
import com.seatplanner.backend.modules.event.presentation.dto.EventDtoMapper;
import com.seatplanner.backend.modules.event.presentation.dto.EventRequest;
import com.seatplanner.backend.modules.event.presentation.dto.EventResponse;
import com.seatplanner.backend.modules.event.presentation.dto.UpdateEventTimesRequest;
import com.seatplanner.backend.modules.event.presentation.dto.UpdateLayoutImageRequest;
import com.seatplanner.backend.modules.layout.domain.LayoutIcon;
import com.seatplanner.backend.modules.layout.infrastructure.persistence.LayoutIconRepository;
import com.seatplanner.backend.modules.layout.infrastructure.persistence.VenueTableRepository;
import com.seatplanner.backend.modules.occupancy.application.OccupancyAggregator;
import com.seatplanner.backend.modules.occupancy.domain.EventOccupancy;
import com.seatplanner.backend.modules.party.infrastructure.persistence.PartyRepository;
import com.seatplanner.backend.modules.seating.infrastructure.persistence.SeatAssignmentRepository;

@Service
@Transactional
public class EventService {

    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final SeatingEventRepository seatingEventRepository;
    private final VenueTableRepository venueTableRepository;
    private final LayoutIconRepository layoutIconRepository;
    private final PartyRepository partyRepository;
    private final SeatAssignmentRepository seatAssignmentRepository;
    private final OccupancyAggregator occupancyAggregator;
    private final SeatingProperties seatingProperties;

    public EventService(
            SeatingEventRepository seatingEventRepository,
            VenueTableRepository venueTableRepository,
            LayoutIconRepository layoutIconRepository,
            PartyRepository partyRepository,
            SeatAssignmentRepository seatAssignmentRepository,
            OccupancyAggregator occupancyAggregator,
            SeatingProperties seatingProperties
    ) {
        this.seatingEventRepository = seatingEventRepository;
        this.venueTableRepository = venueTableRepository;
        this.layoutIconRepository = layoutIconRepository;
        this.partyRepository = partyRepository;
        this.seatAssignmentRepository = seatAssignmentRepository;
        this.occupancyAggregator = occupancyAggregator;
        this.seatingProperties = seatingProperties;
    }

    public EventResponse createEvent(EventRequest request) {
        validate(request);

        SeatingEvent event = new SeatingEvent();
        applyFields(event, request);
        SeatingEvent saved = seatingEventRepository.save(event);

        layoutIconRepository.save(defaultIcon(saved));
        log.info("Created event id={} name='{}' date={}", saved.getId(), saved.getName(), saved.getEventDate());
        return EventDtoMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public EventDetailResponse getEvent(Long eventId) {
        SeatingEvent event = loadEvent(eventId);
        EventOccupancy occupancy = occupancyAggregator.summarizeEvent(eventId);
        return EventDtoMapper.toDetailResponse(event, occupancy);
    }

    @Transactional(readOnly = true)
    public List<EventResponse> listEvents() {
        return seatingEventRepository.findAllByOrderByEventDateDescIdDesc().stream()
                .map(EventDtoMapper::toResponse)
                .toList();
    }

    public EventResponse updateEvent(Long eventId, EventRequest request) {
        validate(request);
        SeatingEvent event = loadEvent(eventId);
        applyFields(event, request);
        return EventDtoMapper.toResponse(seatingEventRepository.saveAndFlush(event));
    }

    public EventResponse updateTimes(Long eventId, UpdateEventTimesRequest request) {
        SeatingEvent event = loadEvent(eventId);
        event.setStartTime(request != null ? request.startTime() : null);
        event.setEndTime(request != null ? request.endTime() : null);
        return EventDtoMapper.toResponse(seatingEventRepository.saveAndFlush(event));
    }

    public EventResponse updateLayoutImage(Long eventId, UpdateLayoutImageRequest request) {
        SeatingEvent event = loadEvent(eventId);
        String image = request != null && StringUtils.hasText(request.layoutImage())
                ? request.layoutImage().trim()
                : null;
        event.setLayoutImage(image);
        return EventDtoMapper.toResponse(seatingEventRepository.saveAndFlush(event));
    }

    /**
     * Removes the event with every table, icon, party and seat claim under it. Seat rows held by the
     * event's parties at other events' tables lose their party reference instead.
     */
    public void deleteEvent(Long eventId) {
        SeatingEvent event = loadEvent(eventId);

        int detachedSeats = seatAssignmentRepository.detachPartiesOfEvent(eventId);
        int deletedSeats = seatAssignmentRepository.deleteAllOfEventTables(eventId);
        int deletedParties = partyRepository.deleteAllOfEvent(eventId);
        int deletedIcons = layoutIconRepository.deleteAllOfEvent(eventId);
        partyRepository.detachFromTablesOfEvent(eventId);
        int deletedTables = venueTableRepository.deleteAllOfEvent(eventId);
        seatingEventRepository.delete(event);

        log.info("Deleted event id={} (tables={}, parties={}, icons={}, seats={}, detachedSeats={})",
                eventId, deletedTables, deletedParties, deletedIcons, deletedSeats, detachedSeats);
    }

    private SeatingEvent loadEvent(Long eventId) {
        return seatingEventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("event", eventId));
    }

    private LayoutIcon defaultIcon(SeatingEvent event) {
        SeatingProperties.DefaultIcon settings = seatingProperties.defaultIcon();
        LayoutIcon icon = new LayoutIcon();
        icon.setEvent(event);
        icon.setIconType(settings.type());
        icon.moveTo(settings.x(), settings.y());
        icon.setSize(settings.size());
        icon.setRotation(0);
        return icon;
    }

    private void validate(EventRequest request) {
        if (request == null || !StringUtils.hasText(request.name())) {
            throw new InvalidRequestException("EVENT_NAME_REQUIRED", "Event name is required");
        }
        if (request.date() == null) {
            throw new InvalidRequestException("EVENT_DATE_REQUIRED", "Event date is required");
        }
    }

    private void applyFields(SeatingEvent event, EventRequest request) {
        event.setName(request.name().trim());
        event.setEventDate(request.date());
        event.setVenue(trimToNull(request.venue()));
        event.setStartTime(request.startTime());
        event.setEndTime(request.endTime());
    }

    private String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}

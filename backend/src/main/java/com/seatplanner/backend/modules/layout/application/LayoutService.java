package com.seatplanner.backend.modules.layout.application;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.seatplanner.backend.global.config.SeatingProperties;
import com.seatplanner.backend.global.error.InvalidRequestException;
import com.seatplanner.backend.global.error.ResourceConflictException;
import com.seatplanner.backend.global.error.ResourceNotFoundException;
import com.seatplanner.backend.modules.event.domain.SeatingEvent;
import com.seatplanner.backend.modules.event.infrastructure.persistence.SeatingEventRepository;
import com.seatplanner.backend.modules.layout.domain.GridPlacement;
import com.seatplanner.backend.modules.layout.domain.VenueTable;
import com.seatplanner.backend.modules.layout.infrastructure.persistence.LayoutIconRepository;
import com.seatplanner.backend.modules.layout.infrastructure.persistence.VenueTableRepository;
import com.seatplanner.backend.modules.layout.presentation.dto.BulkCreateTablesResponse;
import com.seatplanner.backend.modules.layout.presentation.dto.CreateTablesRequest;
import com.seatplanner.backend.modules.layout.presentation.dto.LayoutDtoMapper;
import com.seatplanner.backend.modules.layout.presentation.dto.PositionRequest;
import com.seatplanner.backend.modules.layout.presentation.dto.TableResponse;
import com.seatplanner.backend.modules.layout.presentation.dto.TableSpecInput;
import com.seatplanner.backend.modules.layout.presentation.dto.UpdateTableRequest;
import com.seatplanner.backend.modules.occupancy.application.OccupancyAggregator;
import com.seatplanner.backend.modules.occupancy.domain.TableOccupancy;
import com.seatplanner.backend.modules.party.infrastructure.persistence.PartyRepository;
import com.seatplanner.backend.modules.seating.infrastructure.persistence.SeatAssignmentRepository;

/**
 * Tables of an event's venue canvas.
 */
@Service
@Transactional
public class LayoutService {

    private static final Logger log = LoggerFactory.getLogger(LayoutService.class);

    private final SeatingEventRepository seatingEventRepository;
    private final VenueTableRepository venueTableRepository;
    private final LayoutIconRepository layoutIconRepository;
    private final PartyRepository partyRepository;
    private final SeatAssignmentRepository seatAssignmentRepository;
    private final OccupancyAggregator occupancyAggregator;
    private final GridPlacement gridPlacement;

    public LayoutService(
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
        SeatingProperties.Grid grid = seatingProperties.grid();
        this.gridPlacement = new GridPlacement(grid.columns(), grid.originX(), grid.originY(), grid.spacing());
    }

    /**
     * Creates the whole batch or nothing. Names are checked against each other and against the
     * event's existing tables before the first insert; the unique constraint backs this up under
     * concurrent writers and still rolls the batch back.
     */
    public BulkCreateTablesResponse bulkCreateTables(Long eventId, CreateTablesRequest request) {
        if (request == null || request.tables() == null || request.tables().isEmpty()) {
            throw new InvalidRequestException("TABLE_BATCH_REQUIRED", "At least one table is required");
        }
        SeatingEvent event = loadEvent(eventId);

        List<TableSpecInput> specs = request.tables();
        Set<String> names = new LinkedHashSet<>();
        for (TableSpecInput spec : specs) {
            validateSpec(spec);
            String name = spec.name().trim();
            if (!names.add(name)) {
                log.warn("Rejected table batch for event {}: '{}' appears twice", eventId, name);
                throw duplicateName(name);
            }
        }
        List<String> taken = venueTableRepository.findExistingNames(eventId, names);
        if (!taken.isEmpty()) {
            log.warn("Rejected table batch for event {}: names already used {}", eventId, taken);
            throw duplicateName(taken.get(0));
        }

        List<VenueTable> tables = new ArrayList<>(specs.size());
        for (int index = 0; index < specs.size(); index++) {
            TableSpecInput spec = specs.get(index);
            VenueTable table = new VenueTable();
            table.setEvent(event);
            table.setTableName(spec.name().trim());
            table.setCapacity(spec.capacity());
            table.moveTo(gridPlacement.xAt(index), gridPlacement.yAt(index));
            table.setShape(orDefault(spec.shape(), VenueTable.DEFAULT_SHAPE));
            table.setPurpose(orDefault(spec.purpose(), VenueTable.DEFAULT_PURPOSE));
            table.setColor(orDefault(spec.color(), VenueTable.DEFAULT_COLOR));
            table.setSeatSides(spec.seatSides() != null ? spec.seatSides() : VenueTable.DEFAULT_SEAT_SIDES);
            table.setSeatSidesConfig(trimToNull(spec.seatSidesConfig()));
            table.setShowSeats(spec.showSeats() == null || spec.showSeats());
            tables.add(table);
        }

        List<VenueTable> saved = saveTables(tables);
        log.info("Created {} tables for event {}", saved.size(), eventId);
        List<TableResponse> responses = saved.stream()
                .map(LayoutDtoMapper::toTableResponse)
                .toList();
        return new BulkCreateTablesResponse(responses.size(), responses);
    }

    @Transactional(readOnly = true)
    public List<TableResponse> listTables(Long eventId) {
        ensureEventExists(eventId);
        Map<Long, TableOccupancy> occupancy = occupancyAggregator.summarizeTables(eventId);
        return venueTableRepository.findByEventIdOrderByTableNameAsc(eventId).stream()
                .map(table -> LayoutDtoMapper.toTableResponse(
                        table,
                        occupancy.getOrDefault(table.getId(), TableOccupancy.EMPTY)))
                .toList();
    }

    public TableResponse updateTable(Long tableId, UpdateTableRequest request) {
        if (request == null) {
            throw new InvalidRequestException("TABLE_NAME_REQUIRED", "Table name is required");
        }
        VenueTable table = loadTable(tableId);
        validateAttributes(request.name(), request.capacity());

        String name = request.name().trim();
        Long eventId = table.getEvent().getId();
        if (venueTableRepository.existsByEventIdAndTableNameAndIdNot(eventId, name, tableId)) {
            throw duplicateName(name);
        }

        table.setTableName(name);
        table.setCapacity(request.capacity());
        table.setShape(orDefault(request.shape(), VenueTable.DEFAULT_SHAPE));
        table.setPurpose(orDefault(request.purpose(), VenueTable.DEFAULT_PURPOSE));
        table.setColor(orDefault(request.color(), VenueTable.DEFAULT_COLOR));
        table.setSeatSides(request.seatSides() != null ? request.seatSides() : VenueTable.DEFAULT_SEAT_SIDES);
        table.setSeatSidesConfig(trimToNull(request.seatSidesConfig()));
        table.setShowSeats(request.showSeats() == null || request.showSeats());
        table.setWidth(request.width());
        table.setHeight(request.height());
        table.setRotation(request.rotation() != null ? request.rotation() : 0);

        return LayoutDtoMapper.toTableResponse(saveTables(List.of(table)).get(0));
    }

    /**
     * Last write wins; no version check.
     */
    public void repositionTable(Long tableId, PositionRequest request) {
        if (request == null || request.x() == null || request.y() == null) {
            throw new InvalidRequestException("POSITION_REQUIRED", "Both x and y are required");
        }
        VenueTable table = loadTable(tableId);
        table.moveTo(request.x(), request.y());
        venueTableRepository.save(table);
    }

    /**
     * Parties seated at the table become unassigned and the table's seat claims are dropped.
     */
    public void deleteTable(Long tableId) {
        VenueTable table = loadTable(tableId);
        int detachedParties = partyRepository.detachFromTable(tableId);
        int deletedSeats = seatAssignmentRepository.deleteAllOfTable(tableId);
        venueTableRepository.delete(table);
        log.info("Deleted table {} '{}' (detachedParties={}, seats={})",
                tableId, table.getTableName(), detachedParties, deletedSeats);
    }

    /**
     * Empties the canvas: icons first, then every table with the usual table cascade.
     */
    public void clearLayout(Long eventId) {
        ensureEventExists(eventId);
        int deletedIcons = layoutIconRepository.deleteAllOfEvent(eventId);
        int detachedParties = partyRepository.detachFromTablesOfEvent(eventId);
        int deletedSeats = seatAssignmentRepository.deleteAllOfEventTables(eventId);
        int deletedTables = venueTableRepository.deleteAllOfEvent(eventId);
        log.info("Cleared layout of event {} (icons={}, tables={}, seats={}, detachedParties={})",
                eventId, deletedIcons, deletedTables, deletedSeats, detachedParties);
    }

    private List<VenueTable> saveTables(List<VenueTable> tables) {
        try {
            return venueTableRepository.saveAllAndFlush(tables);
        } catch (DataIntegrityViolationException ex) {
            if (isDuplicateNameViolation(ex)) {
                throw new ResourceConflictException("DUPLICATE_TABLE_NAME",
                        "A table with the same name already exists in this event", ex);
            }
            throw ex;
        }
    }

    private boolean isDuplicateNameViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(VenueTable.EVENT_NAME_CONSTRAINT);
    }

    private void validateSpec(TableSpecInput spec) {
        if (spec == null) {
            throw new InvalidRequestException("TABLE_NAME_REQUIRED", "Table name is required");
        }
        validateAttributes(spec.name(), spec.capacity());
        if (spec.seatSides() != null && spec.seatSides() < 1) {
            throw new InvalidRequestException("INVALID_SEAT_SIDES", "seatSides must be at least 1");
        }
    }

    private void validateAttributes(String name, Integer capacity) {
        if (!StringUtils.hasText(name)) {
            throw new InvalidRequestException("TABLE_NAME_REQUIRED", "Table name is required");
        }
        if (capacity == null || capacity < 1) {
            throw new InvalidRequestException("INVALID_CAPACITY", "Table capacity must be at least 1");
        }
    }

    private ResourceConflictException duplicateName(String name) {
        return new ResourceConflictException("DUPLICATE_TABLE_NAME",
                "Table name '%s' is already used in this event".formatted(name));
    }

    private SeatingEvent loadEvent(Long eventId) {
        return seatingEventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("event", eventId));
    }

    private void ensureEventExists(Long eventId) {
        if (!seatingEventRepository.existsById(eventId)) {
            throw new ResourceNotFoundException("event", eventId);
        }
    }

    private VenueTable loadTable(Long tableId) {
        return venueTableRepository.findWithEventById(tableId)
                .orElseThrow(() -> new ResourceNotFoundException("table", tableId));
    }

    private static String orDefault(String value, String fallback) {
        return StringUtils.hasText(value) ? value.trim() : fallback;
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}

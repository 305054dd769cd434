package com.seatplanner.backend.modules.event.presentation;

import java.util.List;

import com.seatplanner.backend.modules.event.application.EventService;
import com.seatplanner.backend.modules.event.presentation.dto.EventDetailResponse;
import com.seatplanner.backend.modules.event.presentation.dto.EventRequest;
import com.seatplanner.backend.modules.event.presentation.dto.EventResponse;
import com.seatplanner.backend.modules.event.presentation.dto.UpdateEventTimesRequest;
import com.seatplanner.backend.modules.event.presentation.dto.UpdateLayoutImageRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/events")
public class EventController {

    private final EventService eventService;

    public EventController(EventService eventService) {
        this.eventService = eventService;
    }

    @Operation(summary = "Create event", description = "Creates an event and seeds the default stage marker.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "Name or date missing")
    })
    @PostMapping
    public ResponseEntity<EventResponse> createEvent(@Valid @RequestBody EventRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(eventService.createEvent(request));
    }

    @GetMapping
    public ResponseEntity<List<EventResponse>> listEvents() {
        return ResponseEntity.ok(eventService.listEvents());
    }

    @Operation(summary = "Get event with seating statistics")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "Unknown event")
    })
    @GetMapping("/{eventId}")
    public ResponseEntity<EventDetailResponse> getEvent(@PathVariable("eventId") Long eventId) {
        return ResponseEntity.ok(eventService.getEvent(eventId));
    }

    @PutMapping("/{eventId}")
    public ResponseEntity<EventResponse> updateEvent(
            @PathVariable("eventId") Long eventId,
            @Valid @RequestBody EventRequest request
    ) {
        return ResponseEntity.ok(eventService.updateEvent(eventId, request));
    }

    @PutMapping("/{eventId}/times")
    public ResponseEntity<EventResponse> updateTimes(
            @PathVariable("eventId") Long eventId,
            @RequestBody UpdateEventTimesRequest request
    ) {
        return ResponseEntity.ok(eventService.updateTimes(eventId, request));
    }

    @PutMapping("/{eventId}/layout-image")
    public ResponseEntity<EventResponse> updateLayoutImage(
            @PathVariable("eventId") Long eventId,
            @RequestBody UpdateLayoutImageRequest request
    ) {
        return ResponseEntity.ok(eventService.updateLayoutImage(eventId, request));
    }

    @Operation(summary = "Delete event", description = "Removes the event with its tables, icons, parties and seats.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deleted"),
            @ApiResponse(responseCode = "404", description = "Unknown event")
    })
    @DeleteMapping("/{eventId}")
    public ResponseEntity<Void> deleteEvent(@PathVariable("eventId") Long eventId) {
        eventService.deleteEvent(eventId);
        return ResponseEntity.noContent().build();
    }
}

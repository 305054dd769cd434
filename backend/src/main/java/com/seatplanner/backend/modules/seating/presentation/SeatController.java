package com.seatplanner.backend.modules.seating.presentation;

import java.util.List;

import com.seatplanner.backend.modules.seating.application.SeatAssignmentService;
import com.seatplanner.backend.modules.seating.presentation.dto.ClaimSeatRequest;
import com.seatplanner.backend.modules.seating.presentation.dto.SeatAssignmentResponse;

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
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tables/{tableId}/seats")
public class SeatController {

    private final SeatAssignmentService seatAssignmentService;

    public SeatController(SeatAssignmentService seatAssignmentService) {
        this.seatAssignmentService = seatAssignmentService;
    }

    @Operation(summary = "Claim a seat", description = "Replaces the current holder of the seat.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Seat claimed"),
            @ApiResponse(responseCode = "400", description = "Invalid seat, member index or party of another event"),
            @ApiResponse(responseCode = "404", description = "Unknown table or party")
    })
    @PostMapping
    public ResponseEntity<SeatAssignmentResponse> claimSeat(
            @PathVariable("tableId") Long tableId,
            @Valid @RequestBody ClaimSeatRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(seatAssignmentService.claimSeat(tableId, request));
    }

    @GetMapping
    public ResponseEntity<List<SeatAssignmentResponse>> listSeats(@PathVariable("tableId") Long tableId) {
        return ResponseEntity.ok(seatAssignmentService.listSeats(tableId));
    }

    @DeleteMapping("/{seatNumber}")
    public ResponseEntity<Void> releaseSeat(
            @PathVariable("tableId") Long tableId,
            @PathVariable("seatNumber") int seatNumber
    ) {
        seatAssignmentService.releaseSeat(tableId, seatNumber);
        return ResponseEntity.noContent().build();
    }
}

package com.seatplanner.backend.modules.party.presentation;

import java.util.List;

import com.seatplanner.backend.modules.party.application.PartyService;
import com.seatplanner.backend.modules.party.presentation.dto.AssignPartyRequest;
import com.seatplanner.backend.modules.party.presentation.dto.CreatePartyRequest;
import com.seatplanner.backend.modules.party.presentation.dto.PartyResponse;
import com.seatplanner.backend.modules.party.presentation.dto.UpdatePartyRequest;

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
@RequestMapping("/api")
public class PartyController {

    private final PartyService partyService;

    public PartyController(PartyService partyService) {
        this.partyService = partyService;
    }

    @Operation(summary = "Add party", description = "Registers an invitee group and issues its guest token.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created, token included"),
            @ApiResponse(responseCode = "400", description = "Name missing or table of another event"),
            @ApiResponse(responseCode = "404", description = "Unknown event or table")
    })
    @PostMapping("/events/{eventId}/parties")
    public ResponseEntity<PartyResponse> addParty(
            @PathVariable("eventId") Long eventId,
            @Valid @RequestBody CreatePartyRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(partyService.addParty(eventId, request));
    }

    @GetMapping("/events/{eventId}/parties")
    public ResponseEntity<List<PartyResponse>> listParties(@PathVariable("eventId") Long eventId) {
        return ResponseEntity.ok(partyService.listParties(eventId));
    }

    @PutMapping("/parties/{partyId}")
    public ResponseEntity<PartyResponse> updateParty(
            @PathVariable("partyId") Long partyId,
            @Valid @RequestBody UpdatePartyRequest request
    ) {
        return ResponseEntity.ok(partyService.updateParty(partyId, request));
    }

    @Operation(summary = "Assign party to a table", description = "A null tableId unassigns the party.")
    @PutMapping("/parties/{partyId}/assign")
    public ResponseEntity<PartyResponse> assignParty(
            @PathVariable("partyId") Long partyId,
            @RequestBody AssignPartyRequest request
    ) {
        return ResponseEntity.ok(partyService.reassignParty(partyId, request != null ? request.tableId() : null));
    }

    @DeleteMapping("/parties/{partyId}")
    public ResponseEntity<Void> deleteParty(@PathVariable("partyId") Long partyId) {
        partyService.deleteParty(partyId);
        return ResponseEntity.noContent().build();
    }
}

package com.seatplanner.backend.modules.guest.presentation;

import com.seatplanner.backend.modules.guest.application.GuestResolutionService;
import com.seatplanner.backend.modules.guest.presentation.dto.GuestLayoutResponse;
import com.seatplanner.backend.modules.guest.presentation.dto.GuestViewResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/guest/{token}")
public class GuestController {

    private final GuestResolutionService guestResolutionService;

    public GuestController(GuestResolutionService guestResolutionService) {
        this.guestResolutionService = guestResolutionService;
    }

    @Operation(summary = "Resolve guest invitation", description = "Party, assigned table and event for a guest token.")
    @GetMapping
    public ResponseEntity<GuestViewResponse> resolveGuest(@PathVariable("token") String token) {
        return ResponseEntity.ok(guestResolutionService.resolveGuest(token));
    }

    @GetMapping("/layout")
    public ResponseEntity<GuestLayoutResponse> resolveLayout(@PathVariable("token") String token) {
        return ResponseEntity.ok(guestResolutionService.resolveLayout(token));
    }
}

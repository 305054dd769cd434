package com.seatplanner.backend.modules.layout.presentation;

import java.util.List;

import com.seatplanner.backend.modules.layout.application.LayoutIconService;
import com.seatplanner.backend.modules.layout.presentation.dto.CreateIconRequest;
import com.seatplanner.backend.modules.layout.presentation.dto.IconResponse;
import com.seatplanner.backend.modules.layout.presentation.dto.PositionRequest;

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
public class LayoutIconController {

    private final LayoutIconService layoutIconService;

    public LayoutIconController(LayoutIconService layoutIconService) {
        this.layoutIconService = layoutIconService;
    }

    @PostMapping("/events/{eventId}/icons")
    public ResponseEntity<IconResponse> addIcon(
            @PathVariable("eventId") Long eventId,
            @Valid @RequestBody CreateIconRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(layoutIconService.addIcon(eventId, request));
    }

    @GetMapping("/events/{eventId}/icons")
    public ResponseEntity<List<IconResponse>> listIcons(@PathVariable("eventId") Long eventId) {
        return ResponseEntity.ok(layoutIconService.listIcons(eventId));
    }

    @PutMapping("/icons/{iconId}/position")
    public ResponseEntity<Void> repositionIcon(
            @PathVariable("iconId") Long iconId,
            @Valid @RequestBody PositionRequest request
    ) {
        layoutIconService.repositionIcon(iconId, request);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/icons/{iconId}")
    public ResponseEntity<Void> deleteIcon(@PathVariable("iconId") Long iconId) {
        layoutIconService.deleteIcon(iconId);
        return ResponseEntity.noContent().build();
    }
}

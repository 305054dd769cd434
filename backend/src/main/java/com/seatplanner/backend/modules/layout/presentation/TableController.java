package com.seatplanner.backend.modules.layout.presentation;

import java.util.List;

import com.seatplanner.backend.modules.layout.application.LayoutService;
import com.seatplanner.backend.modules.layout.presentation.dto.BulkCreateTablesResponse;
import com.seatplanner.backend.modules.layout.presentation.dto.CreateTablesRequest;
import com.seatplanner.backend.modules.layout.presentation.dto.PositionRequest;
import com.seatplanner.backend.modules.layout.presentation.dto.TableResponse;
import com.seatplanner.backend.modules.layout.presentation.dto.UpdateTableRequest;

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
public class TableController {

    private final LayoutService layoutService;

    public TableController(LayoutService layoutService) {
        this.layoutService = layoutService;
    }

    @Operation(summary = "Create tables in bulk", description = "Places the batch on a 5-column grid. All or nothing.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "All tables created"),
            @ApiResponse(responseCode = "400", description = "Empty batch or invalid table"),
            @ApiResponse(responseCode = "404", description = "Unknown event"),
            @ApiResponse(responseCode = "409", description = "Duplicate table name; nothing was created")
    })
    @PostMapping("/events/{eventId}/tables")
    public ResponseEntity<BulkCreateTablesResponse> createTables(
            @PathVariable("eventId") Long eventId,
            @Valid @RequestBody CreateTablesRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(layoutService.bulkCreateTables(eventId, request));
    }

    @Operation(summary = "List tables with live occupancy")
    @GetMapping("/events/{eventId}/tables")
    public ResponseEntity<List<TableResponse>> listTables(@PathVariable("eventId") Long eventId) {
        return ResponseEntity.ok(layoutService.listTables(eventId));
    }

    @PutMapping("/tables/{tableId}")
    public ResponseEntity<TableResponse> updateTable(
            @PathVariable("tableId") Long tableId,
            @Valid @RequestBody UpdateTableRequest request
    ) {
        return ResponseEntity.ok(layoutService.updateTable(tableId, request));
    }

    @PutMapping("/tables/{tableId}/position")
    public ResponseEntity<Void> repositionTable(
            @PathVariable("tableId") Long tableId,
            @Valid @RequestBody PositionRequest request
    ) {
        layoutService.repositionTable(tableId, request);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Delete table", description = "Unassigns its parties and drops its seat claims.")
    @DeleteMapping("/tables/{tableId}")
    public ResponseEntity<Void> deleteTable(@PathVariable("tableId") Long tableId) {
        layoutService.deleteTable(tableId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Clear layout", description = "Deletes every icon and table of the event.")
    @DeleteMapping("/events/{eventId}/layout")
    public ResponseEntity<Void> clearLayout(@PathVariable("eventId") Long eventId) {
        layoutService.clearLayout(eventId);
        return ResponseEntity.noContent().build();
    }
}

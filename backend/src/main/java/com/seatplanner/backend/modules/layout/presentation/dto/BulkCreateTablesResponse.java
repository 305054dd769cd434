package com.seatplanner.backend.modules.layout.presentation.dto;

import java.util.List;

public record BulkCreateTablesResponse(int created, List<TableResponse> tables) {
}

package com.seatplanner.backend.modules.layout.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

public record CreateTablesRequest(
        @NotEmpty(message = "tables must not be empty") List<@Valid TableSpecInput> tables
) {
}

package com.seatplanner.backend.modules.party.presentation.dto;

/**
 * @param tableId target table, or {@code null} to unassign
 */
public record AssignPartyRequest(Long tableId) {
}

package com.seatplanner.backend.modules.party.presentation.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Contact and headcount only; the table is changed through the assign action.
 */
public record UpdatePartyRequest(
        @NotBlank(message = "name is required") @Size(max = 200) String name,
        @Size(max = 320) String email,
        @Size(max = 64) String phone,
        @Size(max = 100) String groupName,
        @Min(value = 1, message = "partySize must be at least 1") Integer partySize
) {
}

package com.seatplanner.backend.modules.event.presentation.dto;

/**
 * @param layoutImage URL or data URI of the hall plan; {@code null} or blank removes it
 */
public record UpdateLayoutImageRequest(String layoutImage) {
}

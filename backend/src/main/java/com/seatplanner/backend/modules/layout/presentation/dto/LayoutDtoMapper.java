package com.seatplanner.backend.modules.layout.presentation.dto;

import com.seatplanner.backend.modules.layout.domain.LayoutIcon;
import com.seatplanner.backend.modules.layout.domain.VenueTable;
import com.seatplanner.backend.modules.occupancy.domain.TableOccupancy;

public final class LayoutDtoMapper {

    private LayoutDtoMapper() {
    }

    public static TableResponse toTableResponse(VenueTable table) {
        return toTableResponse(table, null);
    }

    /**
     * @param occupancy live counters, or {@code null} to leave them out of the response
     */
    public static TableResponse toTableResponse(VenueTable table, TableOccupancy occupancy) {
        return new TableResponse(
                table.getId(),
                table.getEvent().getId(),
                table.getTableName(),
                table.getCapacity(),
                table.getPositionX(),
                table.getPositionY(),
                table.getShape(),
                table.getPurpose(),
                table.getColor(),
                table.getWidth(),
                table.getHeight(),
                table.getRotation(),
                table.getSeatSides(),
                table.getSeatSidesConfig(),
                table.isShowSeats(),
                occupancy != null ? occupancy.partyCount() : null,
                occupancy != null ? occupancy.seatsOccupied() : null
        );
    }

    public static IconResponse toIconResponse(LayoutIcon icon) {
        return new IconResponse(
                icon.getId(),
                icon.getEvent().getId(),
                icon.getIconType(),
                icon.getPositionX(),
                icon.getPositionY(),
                icon.getSize(),
                icon.getRotation()
        );
    }
}

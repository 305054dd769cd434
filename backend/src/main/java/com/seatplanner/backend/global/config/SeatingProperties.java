package com.seatplanner.backend.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tunables of the seating engine, bound from {@code app.seating.*}.
 *
 * @param grid         placement grid used when tables are created in bulk
 * @param defaultIcon  marker seeded on every new event
 * @param tokenBytes   random bytes behind each guest token (at least 16)
 */
@ConfigurationProperties(prefix = "app.seating")
public record SeatingProperties(
        @DefaultValue Grid grid,
        @DefaultValue DefaultIcon defaultIcon,
        @DefaultValue("16") int tokenBytes
) {

    public SeatingProperties {
        if (tokenBytes < 16) {
            throw new IllegalArgumentException("app.seating.token-bytes must be >= 16");
        }
    }

    public record Grid(
            @DefaultValue("5") int columns,
            @DefaultValue("100") double originX,
            @DefaultValue("100") double originY,
            @DefaultValue("150") double spacing
    ) {

        public Grid {
            if (columns < 1) {
                throw new IllegalArgumentException("app.seating.grid.columns must be >= 1");
            }
        }
    }

    public record DefaultIcon(
            @DefaultValue("stage") String type,
            @DefaultValue("300") double x,
            @DefaultValue("40") double y,
            @DefaultValue("60") int size
    ) {
    }
}

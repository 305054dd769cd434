package com.seatplanner.backend.modules.layout.domain;

/**
 * Row-major placement of freshly created tables on the venue canvas.
 * Positions depend only on the index within the batch, so existing tables are never considered.
 */
public final class GridPlacement {

    private final int columns;
    private final double originX;
    private final double originY;
    private final double spacing;

    public GridPlacement(int columns, double originX, double originY, double spacing) {
        if (columns < 1) {
            throw new IllegalArgumentException("columns must be >= 1");
        }
        this.columns = columns;
        this.originX = originX;
        this.originY = originY;
        this.spacing = spacing;
    }

    public double xAt(int index) {
        requireIndex(index);
        return originX + (index % columns) * spacing;
    }

    public double yAt(int index) {
        requireIndex(index);
        return originY + (index / columns) * spacing;
    }

    private static void requireIndex(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
    }
}

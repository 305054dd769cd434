package com.seatplanner.backend.modules.layout.domain;

import com.seatplanner.backend.global.jpa.AbstractSeatingEntity;
import com.seatplanner.backend.modules.event.domain.SeatingEvent;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

@Entity
@Table(
        name = "venue_table",
        uniqueConstraints = @UniqueConstraint(
                name = VenueTable.EVENT_NAME_CONSTRAINT,
                columnNames = {"event_id", "table_name"}
        )
)
public class VenueTable extends AbstractSeatingEntity {

    public static final String EVENT_NAME_CONSTRAINT = "uq_venue_table_event_name";

    public static final String DEFAULT_SHAPE = "circle";
    public static final String DEFAULT_PURPOSE = "dining table";
    public static final String DEFAULT_COLOR = "#ffffff";
    public static final int DEFAULT_SEAT_SIDES = 2;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "event_id", nullable = false, updatable = false)
    private SeatingEvent event;

    @Column(name = "table_name", nullable = false, length = 100)
    private String tableName;

    @Column(name = "capacity", nullable = false)
    private int capacity;

    @Column(name = "position_x", nullable = false)
    private double positionX;

    @Column(name = "position_y", nullable = false)
    private double positionY;

    @Column(name = "shape", nullable = false, length = 32)
    private String shape = DEFAULT_SHAPE;

    @Column(name = "purpose", nullable = false, length = 64)
    private String purpose = DEFAULT_PURPOSE;

    @Column(name = "color", nullable = false, length = 32)
    private String color = DEFAULT_COLOR;

    @Column(name = "width")
    private Integer width;

    @Column(name = "height")
    private Integer height;

    @Column(name = "rotation", nullable = false)
    private double rotation;

    @Column(name = "seat_sides", nullable = false)
    private int seatSides = DEFAULT_SEAT_SIDES;

    // Free-form per-side seat counts as drawn by the layout editor
    @Column(name = "seat_sides_config")
    private String seatSidesConfig;

    @Column(name = "show_seats", nullable = false)
    private boolean showSeats = true;

    public SeatingEvent getEvent() {
        return event;
    }

    public void setEvent(SeatingEvent event) {
        this.event = event;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public double getPositionX() {
        return positionX;
    }

    public double getPositionY() {
        return positionY;
    }

    public void moveTo(double positionX, double positionY) {
        this.positionX = positionX;
        this.positionY = positionY;
    }

    public String getShape() {
        return shape;
    }

    public void setShape(String shape) {
        this.shape = shape;
    }

    public String getPurpose() {
        return purpose;
    }

    public void setPurpose(String purpose) {
        this.purpose = purpose;
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }

    public Integer getWidth() {
        return width;
    }

    public void setWidth(Integer width) {
        this.width = width;
    }

    public Integer getHeight() {
        return height;
    }

    public void setHeight(Integer height) {
        this.height = height;
    }

    public double getRotation() {
        return rotation;
    }

    public void setRotation(double rotation) {
        this.rotation = rotation;
    }

    public int getSeatSides() {
        return seatSides;
    }

    public void setSeatSides(int seatSides) {
        this.seatSides = seatSides;
    }

    public String getSeatSidesConfig() {
        return seatSidesConfig;
    }

    public void setSeatSidesConfig(String seatSidesConfig) {
        this.seatSidesConfig = seatSidesConfig;
    }

    public boolean isShowSeats() {
        return showSeats;
    }

    public void setShowSeats(boolean showSeats) {
        this.showSeats = showSeats;
    }

    public boolean belongsTo(Long eventId) {
        return event != null && event.isPersisted() && event.getId().equals(eventId);
    }
}

package com.seatplanner.backend.modules.layout.domain;

import com.seatplanner.backend.global.jpa.AbstractSeatingEntity;
import com.seatplanner.backend.modules.event.domain.SeatingEvent;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Decorative marker on the venue canvas (stage, bar, exit...). Never holds seats.
 */
@Entity
@Table(name = "layout_icon")
public class LayoutIcon extends AbstractSeatingEntity {

    public static final int DEFAULT_SIZE = 60;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "event_id", nullable = false, updatable = false)
    private SeatingEvent event;

    @Column(name = "icon_type", nullable = false, length = 64)
    private String iconType;

    @Column(name = "position_x", nullable = false)
    private double positionX;

    @Column(name = "position_y", nullable = false)
    private double positionY;

    @Column(name = "size", nullable = false)
    private int size = DEFAULT_SIZE;

    @Column(name = "rotation", nullable = false)
    private double rotation;

    public SeatingEvent getEvent() {
        return event;
    }

    public void setEvent(SeatingEvent event) {
        this.event = event;
    }

    public String getIconType() {
        return iconType;
    }

    public void setIconType(String iconType) {
        this.iconType = iconType;
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

    public int getSize() {
        return size;
    }

    public void setSize(int size) {
        this.size = size;
    }

    public double getRotation() {
        return rotation;
    }

    public void setRotation(double rotation) {
        this.rotation = rotation;
    }
}

package com.seatplanner.backend.modules.party.domain;

import com.seatplanner.backend.global.jpa.AbstractSeatingEntity;
import com.seatplanner.backend.modules.event.domain.SeatingEvent;
import com.seatplanner.backend.modules.layout.domain.VenueTable;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * An invitee or group sharing one invitation. The guest token is assigned on creation and
 * has no setter.
 */
@Entity
@Table(
        name = "party",
        uniqueConstraints = @UniqueConstraint(name = Party.TOKEN_CONSTRAINT, columnNames = "token")
)
public class Party extends AbstractSeatingEntity {

    public static final String TOKEN_CONSTRAINT = "uq_party_token";

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "event_id", nullable = false, updatable = false)
    private SeatingEvent event;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "table_id")
    private VenueTable table;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "email", length = 320)
    private String email;

    @Column(name = "phone", length = 64)
    private String phone;

    @Column(name = "group_name", length = 100)
    private String groupName;

    @Column(name = "party_size", nullable = false)
    private int partySize = 1;

    @Column(name = "token", nullable = false, updatable = false, length = 128)
    private String token;

    protected Party() {
    }

    public Party(SeatingEvent event, String token) {
        this.event = event;
        this.token = token;
    }

    public SeatingEvent getEvent() {
        return event;
    }

    public VenueTable getTable() {
        return table;
    }

    public void setTable(VenueTable table) {
        this.table = table;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public String getGroupName() {
        return groupName;
    }

    public void setGroupName(String groupName) {
        this.groupName = groupName;
    }

    public int getPartySize() {
        return partySize;
    }

    public void setPartySize(int partySize) {
        this.partySize = partySize;
    }

    public String getToken() {
        return token;
    }

    public boolean belongsTo(Long eventId) {
        return event != null && event.isPersisted() && event.getId().equals(eventId);
    }
}

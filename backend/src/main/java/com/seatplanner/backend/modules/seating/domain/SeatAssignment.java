package com.seatplanner.backend.modules.seating.domain;

import com.seatplanner.backend.global.jpa.AbstractSeatingEntity;
import com.seatplanner.backend.modules.layout.domain.VenueTable;
import com.seatplanner.backend.modules.party.domain.Party;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * One physical seat at a table, optionally held by one member of a party.
 * A row survives the deletion of its party with the party reference cleared.
 */
@Entity
@Table(
        name = "seat_assignment",
        uniqueConstraints = @UniqueConstraint(
                name = SeatAssignment.TABLE_SEAT_CONSTRAINT,
                columnNames = {"table_id", "seat_number"}
        )
)
public class SeatAssignment extends AbstractSeatingEntity {

    public static final String TABLE_SEAT_CONSTRAINT = "uq_seat_assignment_table_seat";

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "table_id", nullable = false, updatable = false)
    private VenueTable table;

    @Column(name = "seat_number", nullable = false, updatable = false)
    private int seatNumber;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "party_id")
    private Party party;

    @Column(name = "member_index")
    private Integer memberIndex;

    protected SeatAssignment() {
    }

    public SeatAssignment(VenueTable table, int seatNumber, Party party, int memberIndex) {
        this.table = table;
        this.seatNumber = seatNumber;
        this.party = party;
        this.memberIndex = memberIndex;
    }

    public VenueTable getTable() {
        return table;
    }

    public int getSeatNumber() {
        return seatNumber;
    }

    public Party getParty() {
        return party;
    }

    public Integer getMemberIndex() {
        return memberIndex;
    }
}

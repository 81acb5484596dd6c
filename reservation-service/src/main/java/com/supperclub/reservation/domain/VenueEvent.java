package com.supperclub.reservation.domain;

import com.supperclub.common.domain.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A scheduled dinner. {@code availableSeats} and {@code availableTables} are
 * derived counters rewritten by the availability calculator only.
 */
@Entity
@Table(name = "events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VenueEvent extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false)
    private Long venueId;

    @Column(nullable = false)
    private LocalDateTime eventDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EventType eventType;

    @Column(nullable = false)
    private int totalSeats;

    @Column(nullable = false)
    private int totalTables;

    private Integer ticketCapacity;

    @Column(nullable = false)
    private int availableSeats;

    @Column(nullable = false)
    private int availableTables;

    @Builder
    private VenueEvent(String title, Long venueId, LocalDateTime eventDate, EventType eventType,
                       int totalSeats, int totalTables, Integer ticketCapacity) {
        this.title = title;
        this.venueId = venueId;
        this.eventDate = eventDate;
        this.eventType = eventType == null ? EventType.TABLE_SEATING : eventType;
        this.totalSeats = totalSeats;
        this.totalTables = totalTables;
        this.ticketCapacity = ticketCapacity;
        this.availableSeats = isTicketOnly() && ticketCapacity != null ? ticketCapacity : totalSeats;
        this.availableTables = isTicketOnly() ? 1 : totalTables;
    }

    public boolean isTicketOnly() {
        return this.eventType == EventType.TICKET_ONLY;
    }
}

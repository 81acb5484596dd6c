package com.supperclub.reservation.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "venue_tables")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VenueTable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long venueId;

    // customer-facing number, not the primary key
    @Column(nullable = false)
    private int tableNumber;

    @Column(nullable = false)
    private int capacity;

    @Column(length = 30)
    private String floor;

    @Builder
    private VenueTable(Long venueId, int tableNumber, int capacity, String floor) {
        this.venueId = venueId;
        this.tableNumber = tableNumber;
        this.capacity = capacity;
        this.floor = floor;
    }
}

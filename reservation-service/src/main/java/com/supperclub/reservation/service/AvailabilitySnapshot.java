package com.supperclub.reservation.service;

public record AvailabilitySnapshot(
        Long eventId,
        int availableSeats,
        int availableTables,
        int totalSeats,
        int totalTables,
        boolean soldOut
) {
}

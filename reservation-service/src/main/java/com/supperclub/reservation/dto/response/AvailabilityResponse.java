package com.supperclub.reservation.dto.response;

import com.supperclub.reservation.service.AvailabilitySnapshot;

public record AvailabilityResponse(
        Long eventId,
        int availableSeats,
        int availableTables,
        int totalSeats,
        int totalTables,
        boolean soldOut
) {
    public static AvailabilityResponse from(AvailabilitySnapshot snapshot) {
        return new AvailabilityResponse(
                snapshot.eventId(),
                snapshot.availableSeats(),
                snapshot.availableTables(),
                snapshot.totalSeats(),
                snapshot.totalTables(),
                snapshot.soldOut());
    }
}

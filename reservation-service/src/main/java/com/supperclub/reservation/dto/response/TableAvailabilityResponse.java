package com.supperclub.reservation.dto.response;

public record TableAvailabilityResponse(Long eventId, Long tableId, boolean available) {
}

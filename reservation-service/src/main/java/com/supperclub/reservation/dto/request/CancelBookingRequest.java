package com.supperclub.reservation.dto.request;

public record CancelBookingRequest(String reason) {
}

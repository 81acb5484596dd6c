package com.supperclub.common.response;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(400, "C001", "Invalid input"),
    RESOURCE_NOT_FOUND(404, "C002", "Resource not found"),
    INTERNAL_ERROR(500, "C003", "Internal server error"),

    // Event / venue
    EVENT_NOT_FOUND(404, "E001", "Event not found"),
    TABLE_NOT_FOUND(404, "E002", "Table not found"),
    TICKET_SALES_CLOSED(400, "E003", "Ticket sales are closed for this event"),
    TICKET_ONLY_EVENT(400, "E004", "This event sells tickets, not tables"),

    // Hold
    TABLE_UNAVAILABLE(409, "H001", "Table is no longer available"),
    HOLD_EXPIRED(410, "H002", "Seat hold has expired"),
    HOLD_FAILED(503, "H003", "Seat hold could not be created"),
    HOLD_NOT_FOUND(404, "H004", "Seat hold not found"),

    // Booking
    DUPLICATE_BOOKING(409, "B001", "You already have a booking for this event"),
    BOOKING_NOT_FOUND(404, "B002", "Booking not found"),
    INVALID_BOOKING_TRANSITION(409, "B003", "Booking status transition is not allowed"),
    BOOKING_VERSION_CONFLICT(409, "B004", "Booking was modified by someone else"),
    INVALID_SELECTION(400, "B005", "Invalid menu selection"),

    // Admin
    SEAT_MODIFICATION_BLOCKED(409, "M001", "Table cannot be modified"),
    ISSUE_NOT_FOUND(404, "M002", "Reconciliation issue not found"),

    // Payment
    INVALID_WEBHOOK_SIGNATURE(400, "P001", "Invalid webhook signature"),
    INVALID_WEBHOOK_PAYLOAD(400, "P002", "Invalid webhook payload");

    private final int status;
    private final String code;
    private final String message;
}

package com.supperclub.reservation.payment;

public enum ReconcileOutcome {
    BOOKING_CONFIRMED,
    DUPLICATE_PAYMENT,
    ESCALATED,
    REFUNDED,
    DISPUTE_FLAGGED,
    BOOKING_NOT_FOUND,
    MALFORMED_METADATA,
    IGNORED
}

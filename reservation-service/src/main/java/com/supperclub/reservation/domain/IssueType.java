package com.supperclub.reservation.domain;

public enum IssueType {
    /** Payment captured but the table was taken before the booking could be written. */
    PAID_UNSEATED,
    PAYMENT_DISPUTED,
    MALFORMED_METADATA,
    NOTIFICATION_FAILED
}

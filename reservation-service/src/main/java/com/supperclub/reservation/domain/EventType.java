package com.supperclub.reservation.domain;

public enum EventType {
    TABLE_SEATING,
    /** General admission with a pooled ticket capacity and no table inventory. */
    TICKET_ONLY
}

package com.supperclub.reservation.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum BookingStatus {

    PENDING,
    RESERVED,
    COMP,
    CONFIRMED,
    MODIFIED,
    REFUNDED,
    CANCELED;

    /** Statuses that occupy a table: availability, holds and admin edits all use this set. */
    public static final Set<BookingStatus> BLOCKING =
            Collections.unmodifiableSet(EnumSet.of(CONFIRMED, RESERVED, COMP, MODIFIED));

    public static final Set<BookingStatus> RELEASED =
            Collections.unmodifiableSet(EnumSet.of(CANCELED, REFUNDED));

    public boolean isBlocking() {
        return BLOCKING.contains(this);
    }

    public boolean isReleased() {
        return RELEASED.contains(this);
    }

    public boolean canTransitionTo(BookingStatus next) {
        return switch (this) {
            case PENDING -> next == RESERVED || next == COMP || next == CONFIRMED || next == CANCELED;
            case RESERVED -> next == CONFIRMED || next == MODIFIED || next == CANCELED || next == REFUNDED;
            case COMP, CONFIRMED, MODIFIED -> next == MODIFIED || next == CANCELED || next == REFUNDED;
            case REFUNDED, CANCELED -> false;
        };
    }
}

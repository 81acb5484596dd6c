package com.supperclub.common.event;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.List;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Topics {

    public static final String BOOKING_RESERVED = "reservation.booking.reserved";
    public static final String BOOKING_CONFIRMED = "reservation.booking.confirmed";
    public static final String BOOKING_MODIFIED = "reservation.booking.modified";
    public static final String BOOKING_CANCELLED = "reservation.booking.cancelled";
    public static final String BOOKING_REFUNDED = "reservation.booking.refunded";

    public static final String ADMIN_ALERT = "reservation.admin.alert";

    /** Booking topics, keyed by dinner event id. */
    public static final List<String> BOOKING_LIFECYCLE = List.of(
            BOOKING_RESERVED, BOOKING_CONFIRMED, BOOKING_MODIFIED,
            BOOKING_CANCELLED, BOOKING_REFUNDED);

    public static final String DLT_SUFFIX = ".DLT";

    public static final int PARTITIONS_BOOKING = 6;
    public static final int PARTITIONS_ADMIN = 1;

    public static String dlt(String topic) {
        return topic + DLT_SUFFIX;
    }

    /** Confirmation mails must not be lost, so only that topic gets a dead-letter twin. */
    public static boolean hasDeadLetter(String topic) {
        return BOOKING_CONFIRMED.equals(topic);
    }
}

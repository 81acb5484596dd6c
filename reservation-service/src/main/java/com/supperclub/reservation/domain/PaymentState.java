package com.supperclub.reservation.domain;

/**
 * Money side of a booking, tracked apart from {@link BookingStatus} so an admin edit
 * (which moves the booking to MODIFIED) does not forget whether the table was paid for.
 */
public enum PaymentState {
    UNPAID,
    COMP,
    PAID
}

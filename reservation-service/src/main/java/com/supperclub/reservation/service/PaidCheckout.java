package com.supperclub.reservation.service;

import com.supperclub.reservation.domain.BookingSelection;

import java.util.List;

/**
 * A captured payment, as carried in checkout metadata. {@code tableId} is null for
 * ticket-only events, where {@code partySize} is the ticket quantity.
 */
public record PaidCheckout(
        Long eventId,
        Long tableId,
        String userId,
        int partySize,
        List<Integer> seatNumbers,
        List<String> guestNames,
        List<BookingSelection> selections,
        String customerEmail,
        String lockToken,
        String paymentReference,
        String checkoutSessionId,
        long amountCents
) {
}

package com.supperclub.reservation.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Admin-created booking. {@code comp} makes it complimentary, otherwise it is
 * reserved and paid later (offline or via a payment link).
 */
public record ManualReservationRequest(
        @NotNull Long eventId,
        @NotNull Long tableId,
        String userId,
        @Email String customerEmail,
        @Positive int partySize,
        List<Integer> seatNumbers,
        List<String> guestNames,
        @Valid List<SelectionRequest> selections,
        String notes,
        boolean comp
) {
}

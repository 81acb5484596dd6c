package com.supperclub.reservation.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Null fields are left unchanged. {@code expectedVersion} is the version the admin read.
 */
public record ModifyBookingRequest(
        @NotNull Long expectedVersion,
        Long tableId,
        @Positive Integer partySize,
        List<Integer> seatNumbers,
        List<String> guestNames,
        @Valid List<SelectionRequest> selections,
        String notes
) {
}

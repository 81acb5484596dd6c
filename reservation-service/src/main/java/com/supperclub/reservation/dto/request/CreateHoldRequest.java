package com.supperclub.reservation.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

public record CreateHoldRequest(
        @NotNull Long eventId,
        @NotNull Long tableId,
        @NotEmpty List<@NotNull @Positive Integer> seatNumbers,
        String sessionId
) {
}

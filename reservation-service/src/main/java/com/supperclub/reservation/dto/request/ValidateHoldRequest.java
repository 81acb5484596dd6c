package com.supperclub.reservation.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ValidateHoldRequest(
        @NotBlank String lockToken,
        @NotNull Long eventId,
        @NotNull Long tableId
) {
}

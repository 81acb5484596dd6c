package com.supperclub.reservation.dto.request;

import jakarta.validation.constraints.Positive;

public record MarkPaidOfflineRequest(
        @Positive long amountCents
) {
}

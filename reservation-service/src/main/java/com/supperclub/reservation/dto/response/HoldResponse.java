package com.supperclub.reservation.dto.response;

import java.time.LocalDateTime;

public record HoldResponse(
        String lockToken,
        long expiresInMs,
        LocalDateTime holdExpiry
) {
}

package com.supperclub.reservation.service;

import com.supperclub.common.exception.BusinessException;
import com.supperclub.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Blocks admin edits that would put a second booking on a SOLD or held table.
 * Always reads live state, never the availability cache.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdminConflictGuard {

    private final BookingValidator bookingValidator;

    public TableReassignmentCheck checkSeatModification(Long tableId, Long eventId, Long excludeBookingId) {
        return bookingValidator.validateTableReassignment(tableId, eventId, excludeBookingId);
    }

    public void guardSeatModification(Long tableId, Long eventId, Long excludeBookingId) {
        TableReassignmentCheck check = checkSeatModification(tableId, eventId, excludeBookingId);
        if (!check.valid()) {
            log.warn("Admin modification blocked: eventId={}, tableId={}, reason={}",
                    eventId, tableId, check.reason());
            throw new BusinessException(ErrorCode.SEAT_MODIFICATION_BLOCKED, check.reason());
        }
    }
}

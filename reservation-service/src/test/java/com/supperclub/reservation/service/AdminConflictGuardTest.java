package com.supperclub.reservation.service;

import com.supperclub.common.exception.BusinessException;
import com.supperclub.common.response.ErrorCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdminConflictGuardTest {

    @Mock
    private BookingValidator bookingValidator;

    @InjectMocks
    private AdminConflictGuard guard;

    @Test
    void guardSeatModification_blockedTable_throwsWithReason() {
        when(bookingValidator.validateTableReassignment(100L, 10L, 5L))
                .thenReturn(TableReassignmentCheck.blocked("Cannot modify table 7 - currently SOLD to a@b.com"));

        assertThatThrownBy(() -> guard.guardSeatModification(100L, 10L, 5L))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Cannot modify table 7 - currently SOLD to a@b.com")
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.SEAT_MODIFICATION_BLOCKED);
    }

    @Test
    void guardSeatModification_freeTable_passes() {
        when(bookingValidator.validateTableReassignment(100L, 10L, null)).thenReturn(TableReassignmentCheck.ok());

        assertThatCode(() -> guard.guardSeatModification(100L, 10L, null)).doesNotThrowAnyException();
    }
}

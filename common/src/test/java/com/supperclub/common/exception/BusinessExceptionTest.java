package com.supperclub.common.exception;

import com.supperclub.common.response.ErrorCode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BusinessExceptionTest {

    @Test
    void constructor_withErrorCode_setsDefaultMessage() {
        BusinessException ex = new BusinessException(ErrorCode.TABLE_UNAVAILABLE);

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.TABLE_UNAVAILABLE);
        assertThat(ex.getMessage()).isEqualTo("Table is no longer available");
    }

    @Test
    void constructor_withCustomMessage_overridesDefault() {
        BusinessException ex = new BusinessException(ErrorCode.SEAT_MODIFICATION_BLOCKED,
                "Cannot modify table 7 - currently SOLD to guest@example.com");

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.SEAT_MODIFICATION_BLOCKED);
        assertThat(ex.getMessage()).contains("SOLD to guest@example.com");
    }
}

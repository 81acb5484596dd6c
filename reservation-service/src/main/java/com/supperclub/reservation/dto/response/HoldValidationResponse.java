package com.supperclub.reservation.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.supperclub.reservation.service.HoldCheck;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HoldValidationResponse(boolean valid, String code) {

    public static HoldValidationResponse from(HoldCheck check) {
        return switch (check) {
            case VALID -> new HoldValidationResponse(true, null);
            case EXPIRED -> new HoldValidationResponse(false, "HOLD_EXPIRED");
            case NOT_FOUND -> new HoldValidationResponse(false, "HOLD_NOT_FOUND");
            case MISMATCH -> new HoldValidationResponse(false, "HOLD_MISMATCH");
            case INACTIVE -> new HoldValidationResponse(false, "HOLD_INACTIVE");
        };
    }
}

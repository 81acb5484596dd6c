package com.supperclub.reservation.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.supperclub.reservation.service.TableReassignmentCheck;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModificationCheckResponse(boolean valid, String reason) {

    public static ModificationCheckResponse from(TableReassignmentCheck check) {
        return new ModificationCheckResponse(check.valid(), check.reason());
    }
}

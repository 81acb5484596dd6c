package com.supperclub.common.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Error body. {@code reason} is the {@link ErrorCode} name clients switch on;
 * {@code fieldErrors} is only present for rejected request bodies.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {

    private final String code;
    private final String reason;
    private final String message;
    private final List<FieldError> fieldErrors;

    public static ErrorResponse of(ErrorCode errorCode) {
        return of(errorCode, errorCode.getMessage());
    }

    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(errorCode.getCode(), errorCode.name(), message, List.of());
    }

    public static ErrorResponse rejected(List<FieldError> fieldErrors) {
        ErrorCode errorCode = ErrorCode.INVALID_INPUT;
        return new ErrorResponse(errorCode.getCode(), errorCode.name(), errorCode.getMessage(),
                List.copyOf(fieldErrors));
    }

    public record FieldError(String field, String message) {
    }
}

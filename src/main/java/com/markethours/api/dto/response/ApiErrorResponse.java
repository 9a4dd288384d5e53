package com.markethours.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.markethours.exception.BaseException;
import com.markethours.exception.ErrorCode;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Failure envelope. {@code violations} is present only for schedule validation failures,
 * one entry per rejected record.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, String path, Instant respondedAt) {
        return of(errorCode, message, List.of(), path, respondedAt);
    }

    public static ApiErrorResponse from(BaseException ex, String path, Instant respondedAt) {
        return of(ex.getErrorCode(), ex.getMessage(), ex.getViolations(), path, respondedAt);
    }

    private static ApiErrorResponse of(
            ErrorCode errorCode, String message, List<String> violations, String path, Instant respondedAt) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .violations(violations)
                .path(path)
                .respondedAt(respondedAt)
                .build());
    }

    @Getter
    @Builder
    public static class ErrorDetail {
        private final String code;
        private final int status;
        private final String message;

        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        private final List<String> violations;

        private final String path;
        private final Instant respondedAt;
    }
}

package com.markethours.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_INPUT("INVALID_INPUT", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    NO_UPCOMING_SESSION("NO_UPCOMING_SESSION", 404),
    SCHEDULE_VALIDATION_ERROR("SCHEDULE_VALIDATION_ERROR", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    ACQUISITION_ERROR("ACQUISITION_ERROR", 502),
    SCHEDULE_PARSE_ERROR("SCHEDULE_PARSE_ERROR", 502);

    private final String code;
    private final int httpStatus;
}

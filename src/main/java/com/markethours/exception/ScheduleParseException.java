package com.markethours.exception;

/**
 * The upstream schedule was fetched but its shape is not recognised. Unlike
 * {@link AcquisitionException} this will not fix itself on retry and needs an operator.
 */
public class ScheduleParseException extends BaseException {

    public ScheduleParseException(String message) {
        super(ErrorCode.SCHEDULE_PARSE_ERROR, message);
    }

    public ScheduleParseException(String message, Throwable cause) {
        super(ErrorCode.SCHEDULE_PARSE_ERROR, message, cause);
    }
}

package com.markethours.exception;

import java.util.List;

/** Fetched schedule parsed fine but is internally inconsistent. The refresh cycle is aborted. */
public class ScheduleValidationException extends BaseException {

    public ScheduleValidationException(List<String> violations) {
        super(
                ErrorCode.SCHEDULE_VALIDATION_ERROR,
                "Schedule failed validation: " + String.join("; ", violations),
                violations);
    }
}

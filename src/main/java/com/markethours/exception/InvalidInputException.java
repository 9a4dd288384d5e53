package com.markethours.exception;

/**
 * Thrown when a query argument cannot be resolved, e.g. a timestamp without an offset
 * or zone, an unknown zone id, or an inverted date range. Caller error.
 */
public class InvalidInputException extends BaseException {

    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(ErrorCode.INVALID_INPUT, message, cause);
    }
}

package com.markethours.exception;

/**
 * Boundary search ran past its lookahead without finding a session, which points at a gap
 * in the calendar data (e.g. next year's schedule missing near year end).
 */
public class NoUpcomingSessionException extends BaseException {

    public NoUpcomingSessionException(String message) {
        super(ErrorCode.NO_UPCOMING_SESSION, message);
    }
}

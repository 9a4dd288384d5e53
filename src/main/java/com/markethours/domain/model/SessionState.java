package com.markethours.domain.model;

import com.markethours.domain.enums.SessionStatus;
import java.time.LocalTime;
import lombok.Value;

/**
 * Result of classifying an instant against the calendar.
 *
 * <p>{@code holidayName} is set for CLOSED_HOLIDAY and CLOSED_EARLY; {@code closedAt}
 * (exchange-local) only for CLOSED_EARLY.
 */
@Value
public class SessionState {

    private static final SessionState OPEN = new SessionState(SessionStatus.OPEN, null, null);
    private static final SessionState WEEKEND = new SessionState(SessionStatus.CLOSED_WEEKEND, null, null);
    private static final SessionState BEFORE_HOURS = new SessionState(SessionStatus.CLOSED_BEFORE_HOURS, null, null);
    private static final SessionState AFTER_HOURS = new SessionState(SessionStatus.CLOSED_AFTER_HOURS, null, null);

    SessionStatus status;
    String holidayName;
    LocalTime closedAt;

    public static SessionState open() {
        return OPEN;
    }

    public static SessionState weekend() {
        return WEEKEND;
    }

    public static SessionState beforeHours() {
        return BEFORE_HOURS;
    }

    public static SessionState afterHours() {
        return AFTER_HOURS;
    }

    public static SessionState holiday(String name) {
        return new SessionState(SessionStatus.CLOSED_HOLIDAY, name, null);
    }

    public static SessionState earlyClose(String name, LocalTime closedAt) {
        return new SessionState(SessionStatus.CLOSED_EARLY, name, closedAt);
    }

    public boolean isOpen() {
        return status.isOpen();
    }
}

package com.markethours.domain.enums;

/**
 * Trading-session state of the exchange at a given instant.
 *
 * <pre>
 * OPEN                 - regular or shortened session in progress
 * CLOSED_WEEKEND       - Saturday or Sunday (exchange-local)
 * CLOSED_HOLIDAY       - full-closure holiday
 * CLOSED_BEFORE_HOURS  - trading day, before 09:30 ET
 * CLOSED_AFTER_HOURS   - trading day, at or after 16:00 ET
 * CLOSED_EARLY         - early-close day, at or after the shortened close
 * </pre>
 */
public enum SessionStatus {
    OPEN,
    CLOSED_WEEKEND,
    CLOSED_HOLIDAY,
    CLOSED_BEFORE_HOURS,
    CLOSED_AFTER_HOURS,
    CLOSED_EARLY;

    public boolean isOpen() {
        return this == OPEN;
    }
}

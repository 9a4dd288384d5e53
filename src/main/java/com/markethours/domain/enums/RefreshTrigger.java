package com.markethours.domain.enums;

/** What started a refresh cycle. Stored on every refresh record for the audit trail. */
public enum RefreshTrigger {
    STARTUP,
    SCHEDULED,
    MANUAL
}

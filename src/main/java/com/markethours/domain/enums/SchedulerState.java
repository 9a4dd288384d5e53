package com.markethours.domain.enums;

/**
 * Lifecycle of the refresh scheduler.
 *
 * <pre>
 * IDLE     - waiting for the next trigger hour
 * RUNNING  - a refresh cycle is executing
 * STOPPED  - never started (disabled) or shut down; terminal
 * </pre>
 */
public enum SchedulerState {
    IDLE,
    RUNNING,
    STOPPED
}

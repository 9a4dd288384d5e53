package com.markethours.event;

import com.markethours.domain.model.RefreshRecord;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every refresh cycle attempt, successful or not, once its
 * {@link RefreshRecord} has been appended.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>RefreshMetricsService - success/failure counters</li>
 * </ul>
 */
public class CalendarRefreshedEvent extends ApplicationEvent {

    private final RefreshRecord refreshRecord;

    public CalendarRefreshedEvent(Object source, RefreshRecord refreshRecord) {
        super(source);
        this.refreshRecord = refreshRecord;
    }

    public RefreshRecord getRefreshRecord() {
        return refreshRecord;
    }
}

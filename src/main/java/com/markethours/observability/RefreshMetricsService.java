package com.markethours.observability;

import com.markethours.domain.model.RefreshRecord;
import com.markethours.event.CalendarRefreshedEvent;
import com.markethours.store.CalendarStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Calendar refresh meters:
 * <ul>
 *   <li>{@code calendar.refresh.success} / {@code calendar.refresh.failure}: cycles by outcome</li>
 *   <li>{@code calendar.holidays.loaded}: holidays in the published snapshot</li>
 * </ul>
 */
@Service
public class RefreshMetricsService {

    private final Counter refreshSuccess;
    private final Counter refreshFailure;

    public RefreshMetricsService(MeterRegistry meterRegistry, CalendarStore calendarStore) {
        this.refreshSuccess = Counter.builder("calendar.refresh.success")
                .description("Refresh cycles that committed a new calendar")
                .register(meterRegistry);
        this.refreshFailure = Counter.builder("calendar.refresh.failure")
                .description("Refresh cycles that kept the previous calendar")
                .register(meterRegistry);
        Gauge.builder("calendar.holidays.loaded", calendarStore, store -> store.snapshot().holidayCount())
                .description("Holidays in the published calendar")
                .register(meterRegistry);
    }

    @EventListener
    public void onCalendarRefreshed(CalendarRefreshedEvent event) {
        RefreshRecord record = event.getRefreshRecord();
        if (record.isSuccess()) {
            refreshSuccess.increment();
        } else {
            refreshFailure.increment();
        }
    }

    public double getSuccessCount() {
        return refreshSuccess.count();
    }

    public double getFailureCount() {
        return refreshFailure.count();
    }
}

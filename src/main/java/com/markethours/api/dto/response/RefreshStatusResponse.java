package com.markethours.api.dto.response;

import com.markethours.domain.enums.SchedulerState;
import com.markethours.domain.enums.SnapshotOrigin;
import com.markethours.domain.model.RefreshRecord;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Response DTO for GET /api/market-hours/refresh/last and POST /api/market-hours/refresh.
 *
 * <p>Carries the latest refresh record alongside the state of the published calendar, so
 * a caller can see both that a refresh failed and which calendar is still being served.
 */
@Getter
@Builder
public class RefreshStatusResponse {

    private final RefreshRecord lastRefresh;
    private final RefreshRecord lastSuccessfulRefresh;
    private final SchedulerState schedulerState;
    private final Instant nextRunAt;
    private final SnapshotOrigin calendarOrigin;
    private final Instant calendarRefreshedAt;
    private final int holidaysLoaded;
}

package com.markethours.api.controller;

import com.markethours.api.dto.response.BoundaryResponse;
import com.markethours.api.dto.response.RefreshStatusResponse;
import com.markethours.api.dto.response.SessionStatusResponse;
import com.markethours.calendar.CalendarSnapshot;
import com.markethours.calendar.ExchangeHours;
import com.markethours.calendar.MarketCalendarService;
import com.markethours.domain.enums.BoundaryDirection;
import com.markethours.domain.model.DaySchedule;
import com.markethours.domain.model.Holiday;
import com.markethours.domain.model.MarketEvent;
import com.markethours.domain.model.RefreshRecord;
import com.markethours.domain.model.SessionState;
import com.markethours.exception.InvalidInputException;
import com.markethours.refresh.RefreshOrchestrator;
import com.markethours.refresh.RefreshScheduler;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for market session queries and calendar refresh control.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/market-hours/status?at=&amp;zone= -- session status at an instant (default now)</li>
 *   <li>GET /api/market-hours/today -- today's schedule</li>
 *   <li>GET /api/market-hours/date/{date} -- schedule for a date</li>
 *   <li>GET /api/market-hours/week?startDate= -- seven-day schedule</li>
 *   <li>GET /api/market-hours/next -- next open or close</li>
 *   <li>GET /api/market-hours/boundary?direction=&amp;at= -- next open/close after an instant</li>
 *   <li>GET /api/market-hours/holidays?start=&amp;end= -- holidays in a date range</li>
 *   <li>GET /api/market-hours/refresh/last -- last refresh outcome</li>
 *   <li>GET /api/market-hours/refresh/history?limit= -- recent refresh records</li>
 *   <li>POST /api/market-hours/refresh -- run a refresh cycle now</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/market-hours")
public class MarketHoursController {

    private static final int MAX_HISTORY = 100;
    private static final DateTimeFormatter EXCHANGE_TIME = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private final MarketCalendarService marketCalendarService;
    private final RefreshOrchestrator refreshOrchestrator;
    private final RefreshScheduler refreshScheduler;

    public MarketHoursController(
            MarketCalendarService marketCalendarService,
            RefreshOrchestrator refreshOrchestrator,
            RefreshScheduler refreshScheduler) {
        this.marketCalendarService = marketCalendarService;
        this.refreshOrchestrator = refreshOrchestrator;
        this.refreshScheduler = refreshScheduler;
    }

    @GetMapping("/status")
    public ResponseEntity<SessionStatusResponse> getStatus(
            @RequestParam(required = false) String at, @RequestParam(required = false) String zone) {
        Instant instant = marketCalendarService.resolveInstant(at, zone);
        SessionState state = marketCalendarService.classify(instant);
        return ResponseEntity.ok(SessionStatusResponse.builder()
                .at(instant)
                .exchangeTime(exchangeTime(instant))
                .status(state.getStatus())
                .open(state.isOpen())
                .holidayName(state.getHolidayName())
                .closedAt(state.getClosedAt())
                .build());
    }

    @GetMapping("/today")
    public ResponseEntity<DaySchedule> getToday() {
        return ResponseEntity.ok(marketCalendarService.getToday());
    }

    @GetMapping("/date/{date}")
    public ResponseEntity<DaySchedule> getDate(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(marketCalendarService.getSchedule(date));
    }

    @GetMapping("/week")
    public ResponseEntity<List<DaySchedule>> getWeek(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate) {
        return ResponseEntity.ok(marketCalendarService.getWeekSchedule(startDate));
    }

    @GetMapping("/next")
    public ResponseEntity<MarketEvent> getNextEvent() {
        return ResponseEntity.ok(marketCalendarService.getNextEvent());
    }

    @GetMapping("/boundary")
    public ResponseEntity<BoundaryResponse> getBoundary(
            @RequestParam BoundaryDirection direction,
            @RequestParam(required = false) String at,
            @RequestParam(required = false) String zone) {
        Instant from = marketCalendarService.resolveInstant(at, zone);
        Instant boundary = marketCalendarService.nextSessionBoundary(from, direction);
        return ResponseEntity.ok(BoundaryResponse.builder()
                .direction(direction)
                .from(from)
                .boundary(boundary)
                .exchangeTime(exchangeTime(boundary))
                .secondsUntil(Duration.between(from, boundary).getSeconds())
                .build());
    }

    @GetMapping("/holidays")
    public ResponseEntity<List<Holiday>> getHolidays(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return ResponseEntity.ok(marketCalendarService.getCalendarRange(start, end));
    }

    @GetMapping("/refresh/last")
    public ResponseEntity<RefreshStatusResponse> getLastRefresh() {
        return ResponseEntity.ok(refreshStatus(refreshOrchestrator.getLastRefresh().orElse(null)));
    }

    @GetMapping("/refresh/history")
    public ResponseEntity<List<RefreshRecord>> getRefreshHistory(@RequestParam(defaultValue = "20") int limit) {
        if (limit < 1 || limit > MAX_HISTORY) {
            throw new InvalidInputException("limit must be between 1 and " + MAX_HISTORY);
        }
        return ResponseEntity.ok(refreshOrchestrator.getRefreshHistory(limit));
    }

    /** Runs a manual refresh and returns its outcome. A failed refresh is still a 200. */
    @PostMapping("/refresh")
    public ResponseEntity<RefreshStatusResponse> triggerRefresh() {
        return ResponseEntity.ok(refreshStatus(refreshScheduler.triggerNow()));
    }

    private RefreshStatusResponse refreshStatus(RefreshRecord lastRefresh) {
        CalendarSnapshot snapshot = marketCalendarService.currentSnapshot();
        return RefreshStatusResponse.builder()
                .lastRefresh(lastRefresh)
                .lastSuccessfulRefresh(refreshOrchestrator.getLastSuccessfulRefresh().orElse(null))
                .schedulerState(refreshScheduler.getState())
                .nextRunAt(refreshScheduler.getNextRunAt().orElse(null))
                .calendarOrigin(snapshot.getOrigin())
                .calendarRefreshedAt(snapshot.getRefreshedAt())
                .holidaysLoaded(snapshot.holidayCount())
                .build();
    }

    private static String exchangeTime(Instant instant) {
        return instant.atZone(ExchangeHours.ZONE).format(EXCHANGE_TIME);
    }
}

package com.markethours.unit.refresh;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.markethours.acquisition.ScheduleSource;
import com.markethours.domain.enums.ClosureKind;
import com.markethours.domain.enums.RefreshStatus;
import com.markethours.domain.enums.RefreshTrigger;
import com.markethours.domain.model.RawScheduleRecord;
import com.markethours.domain.model.RawScheduleRecords;
import com.markethours.domain.model.RefreshRecord;
import com.markethours.domain.model.YearRange;
import com.markethours.event.CalendarRefreshedEvent;
import com.markethours.exception.AcquisitionException;
import com.markethours.exception.ScheduleParseException;
import com.markethours.refresh.RefreshOrchestrator;
import com.markethours.refresh.ScheduleValidator;
import com.markethours.store.CalendarStore;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RefreshOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T06:00:00Z");
    private static final YearRange YEARS = YearRange.of(2024, 2025);

    @Mock
    private ScheduleSource scheduleSource;

    @Mock
    private CalendarStore calendarStore;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private RefreshOrchestrator refreshOrchestrator;

    @BeforeEach
    void setUp() {
        when(scheduleSource.name()).thenReturn("NYSE");
        when(calendarStore.appendRefreshRecord(any(RefreshRecord.class)))
                .thenAnswer(invocation -> ((RefreshRecord) invocation.getArgument(0)).toBuilder().id(1L).build());
        refreshOrchestrator = new RefreshOrchestrator(
                scheduleSource,
                new ScheduleValidator(),
                calendarStore,
                applicationEventPublisher,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Successful cycle fetches current and next year, commits, and records SUCCESS")
    void successfulCycle() {
        when(scheduleSource.fetchSchedule(YEARS)).thenReturn(RawScheduleRecords.builder()
                .source("NYSE")
                .yearRange(YEARS)
                .record(RawScheduleRecord.builder().date(LocalDate.of(2024, 7, 4)).name("Independence Day")
                        .closureKind(ClosureKind.FULL_CLOSURE).build())
                .record(RawScheduleRecord.builder().date(LocalDate.of(2024, 7, 3)).name("Independence Day Eve")
                        .closureKind(ClosureKind.EARLY_CLOSE).closeTime(LocalTime.of(13, 0)).build())
                .build());

        RefreshRecord record = refreshOrchestrator.runRefreshCycle(RefreshTrigger.SCHEDULED);

        assertThat(record.getStatus()).isEqualTo(RefreshStatus.SUCCESS);
        assertThat(record.getRecordsIngested()).isEqualTo(2);
        assertThat(record.getTrigger()).isEqualTo(RefreshTrigger.SCHEDULED);
        assertThat(record.getRunAt()).isEqualTo(NOW);
        assertThat(record.getError()).isNull();
        verify(calendarStore).commit(eq(YEARS), anyList(), anyList(), eq(NOW));
    }

    @Test
    @DisplayName("Acquisition timeout yields a FAILURE record and no commit")
    void acquisitionFailure() {
        when(scheduleSource.fetchSchedule(YEARS)).thenThrow(new AcquisitionException("Read timed out"));

        RefreshRecord record = refreshOrchestrator.runRefreshCycle(RefreshTrigger.MANUAL);

        assertThat(record.getStatus()).isEqualTo(RefreshStatus.FAILURE);
        assertThat(record.getError()).startsWith("ACQUISITION_ERROR").contains("Read timed out");
        assertThat(record.getRecordsIngested()).isZero();
        verify(calendarStore, never()).commit(any(), anyList(), anyList(), any());
        verify(calendarStore).appendRefreshRecord(any(RefreshRecord.class));
    }

    @Test
    @DisplayName("Parse error is distinguishable from a transient failure")
    void parseFailure() {
        when(scheduleSource.fetchSchedule(YEARS)).thenThrow(new ScheduleParseException("no 'holidays' array"));

        RefreshRecord record = refreshOrchestrator.runRefreshCycle(RefreshTrigger.SCHEDULED);

        assertThat(record.getStatus()).isEqualTo(RefreshStatus.FAILURE);
        assertThat(record.getError()).startsWith("SCHEDULE_PARSE_ERROR");
    }

    @Test
    @DisplayName("Validation failure aborts the cycle before commit")
    void validationFailure() {
        RawScheduleRecord christmas = RawScheduleRecord.builder().date(LocalDate.of(2024, 12, 25)).name("Christmas")
                .closureKind(ClosureKind.FULL_CLOSURE).build();
        when(scheduleSource.fetchSchedule(YEARS)).thenReturn(RawScheduleRecords.builder()
                .source("NYSE").record(christmas).record(christmas).build());

        RefreshRecord record = refreshOrchestrator.runRefreshCycle(RefreshTrigger.SCHEDULED);

        assertThat(record.getStatus()).isEqualTo(RefreshStatus.FAILURE);
        assertThat(record.getError()).startsWith("SCHEDULE_VALIDATION_ERROR").contains("duplicate date");
        verify(calendarStore, never()).commit(any(), anyList(), anyList(), any());
    }

    @Test
    @DisplayName("Database failure during commit yields FAILURE instead of escaping")
    void commitFailure() {
        when(scheduleSource.fetchSchedule(YEARS)).thenReturn(RawScheduleRecords.builder().source("NYSE").build());
        when(calendarStore.commit(any(), anyList(), anyList(), any()))
                .thenThrow(new DataAccessResourceFailureException("disk full"));

        RefreshRecord record = refreshOrchestrator.runRefreshCycle(RefreshTrigger.SCHEDULED);

        assertThat(record.getStatus()).isEqualTo(RefreshStatus.FAILURE);
        assertThat(record.getError()).startsWith("INTERNAL_ERROR").contains("disk full");
    }

    @Test
    @DisplayName("A failure to append the record still returns the outcome")
    void appendFailure() {
        when(scheduleSource.fetchSchedule(YEARS)).thenThrow(new AcquisitionException("connection refused"));
        when(calendarStore.appendRefreshRecord(any(RefreshRecord.class)))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        RefreshRecord record = refreshOrchestrator.runRefreshCycle(RefreshTrigger.SCHEDULED);

        assertThat(record.getStatus()).isEqualTo(RefreshStatus.FAILURE);
        assertThat(record.getId()).isNull();
    }

    @Test
    @DisplayName("Publishes CalendarRefreshedEvent with the saved record")
    void publishesEvent() {
        when(scheduleSource.fetchSchedule(YEARS)).thenThrow(new AcquisitionException("unreachable"));

        RefreshRecord record = refreshOrchestrator.runRefreshCycle(RefreshTrigger.STARTUP);

        ArgumentCaptor<CalendarRefreshedEvent> captor = ArgumentCaptor.forClass(CalendarRefreshedEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getRefreshRecord()).isEqualTo(record);
        assertThat(record.getId()).isEqualTo(1L);
    }

    @Test
    @DisplayName("tryRunRefreshCycle skips while another cycle holds the lock")
    void trySkipsWhenBusy() throws Exception {
        CountDownLatch fetching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(scheduleSource.fetchSchedule(YEARS)).thenAnswer(invocation -> {
            fetching.countDown();
            release.await(5, TimeUnit.SECONDS);
            return RawScheduleRecords.builder().source("NYSE").build();
        });

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<RefreshRecord> running =
                    executor.submit(() -> refreshOrchestrator.runRefreshCycle(RefreshTrigger.MANUAL));
            assertThat(fetching.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(refreshOrchestrator.isCycleInProgress()).isTrue();
            Optional<RefreshRecord> skipped = refreshOrchestrator.tryRunRefreshCycle(RefreshTrigger.SCHEDULED);

            release.countDown();
            assertThat(skipped).isEmpty();
            assertThat(running.get(5, TimeUnit.SECONDS).getStatus()).isEqualTo(RefreshStatus.SUCCESS);
            assertThat(refreshOrchestrator.isCycleInProgress()).isFalse();
        } finally {
            executor.shutdownNow();
        }
    }
}

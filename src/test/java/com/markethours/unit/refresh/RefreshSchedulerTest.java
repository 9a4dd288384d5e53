package com.markethours.unit.refresh;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.markethours.calendar.MarketCalendarProperties;
import com.markethours.domain.enums.RefreshStatus;
import com.markethours.domain.enums.RefreshTrigger;
import com.markethours.domain.enums.SchedulerState;
import com.markethours.domain.model.RefreshRecord;
import com.markethours.refresh.RefreshOrchestrator;
import com.markethours.refresh.RefreshScheduler;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;

/**
 * Unit tests for RefreshScheduler: daily cron computation, lifecycle, state reporting, and
 * that a failing or skipped cycle never stops the daily schedule.
 */
class RefreshSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:15:00Z");

    private RefreshOrchestrator refreshOrchestrator;
    private TaskScheduler taskScheduler;
    private ScheduledFuture<?> future;
    private MarketCalendarProperties properties;
    private RefreshScheduler refreshScheduler;

    @BeforeEach
    void setUp() {
        refreshOrchestrator = mock(RefreshOrchestrator.class);
        taskScheduler = mock(TaskScheduler.class);
        future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));

        properties = new MarketCalendarProperties();
        properties.getRefresh().setScheduleHour(6);
        properties.getRefresh().setRunOnStartup(false);

        refreshScheduler = new RefreshScheduler(
                refreshOrchestrator, taskScheduler, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Next trigger computation")
    class NextTrigger {

        @Test
        @DisplayName("After today's hour the next run is tomorrow")
        void afterHourIsTomorrow() {
            assertThat(refreshScheduler.nextTriggerAfter(Instant.parse("2024-03-01T10:15:00Z")))
                    .isEqualTo(Instant.parse("2024-03-02T06:00:00Z"));
        }

        @Test
        @DisplayName("Before today's hour the next run is today")
        void beforeHourIsToday() {
            assertThat(refreshScheduler.nextTriggerAfter(Instant.parse("2024-03-01T05:59:59Z")))
                    .isEqualTo(Instant.parse("2024-03-01T06:00:00Z"));
        }

        @Test
        @DisplayName("Exactly at the hour the next run is tomorrow")
        void atHourIsTomorrow() {
            assertThat(refreshScheduler.nextTriggerAfter(Instant.parse("2024-03-01T06:00:00Z")))
                    .isEqualTo(Instant.parse("2024-03-02T06:00:00Z"));
        }

        @Test
        @DisplayName("UTC hour is unaffected by US daylight saving")
        void ignoresDst() {
            assertThat(refreshScheduler.nextTriggerAfter(Instant.parse("2024-03-10T12:00:00Z")))
                    .isEqualTo(Instant.parse("2024-03-11T06:00:00Z"));
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("start registers a daily UTC cron trigger and goes IDLE")
        void startSchedulesNextRun() {
            refreshScheduler.start();

            assertThat(refreshScheduler.isRunning()).isTrue();
            assertThat(refreshScheduler.getState()).isEqualTo(SchedulerState.IDLE);
            assertThat(refreshScheduler.getNextRunAt()).contains(Instant.parse("2024-03-02T06:00:00Z"));
            ArgumentCaptor<Trigger> trigger = ArgumentCaptor.forClass(Trigger.class);
            verify(taskScheduler).schedule(any(Runnable.class), trigger.capture());
            assertThat(trigger.getValue()).isInstanceOf(CronTrigger.class);
            assertThat(((CronTrigger) trigger.getValue()).getExpression()).isEqualTo("0 0 6 * * *");
            verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
        }

        @Test
        @DisplayName("start with run-on-startup also schedules an immediate cycle")
        void startupCycle() {
            properties.getRefresh().setRunOnStartup(true);
            when(refreshOrchestrator.tryRunRefreshCycle(RefreshTrigger.STARTUP)).thenReturn(Optional.of(record()));

            refreshScheduler.start();

            ArgumentCaptor<Runnable> startupTask = ArgumentCaptor.forClass(Runnable.class);
            verify(taskScheduler).schedule(startupTask.capture(), eq(NOW));
            verify(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
            startupTask.getValue().run();
            verify(refreshOrchestrator).tryRunRefreshCycle(RefreshTrigger.STARTUP);
        }

        @Test
        @DisplayName("Disabled refresh never schedules anything")
        void disabled() {
            properties.getRefresh().setEnabled(false);

            refreshScheduler.start();

            assertThat(refreshScheduler.isRunning()).isFalse();
            assertThat(refreshScheduler.getState()).isEqualTo(SchedulerState.STOPPED);
            verifyNoInteractions(taskScheduler);
        }

        @Test
        @DisplayName("An out-of-range hour fails fast")
        void invalidHour() {
            properties.getRefresh().setScheduleHour(24);

            assertThatThrownBy(() -> refreshScheduler.start()).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("stop cancels the pending run and goes STOPPED")
        void stopCancels() {
            refreshScheduler.start();

            refreshScheduler.stop();

            assertThat(refreshScheduler.isRunning()).isFalse();
            assertThat(refreshScheduler.getState()).isEqualTo(SchedulerState.STOPPED);
            assertThat(refreshScheduler.getNextRunAt()).isEmpty();
            verify(future).cancel(false);
        }
    }

    @Nested
    @DisplayName("Scheduled cycles")
    class ScheduledCycles {

        @Test
        @DisplayName("A cycle that throws is logged and the daily trigger stays registered")
        void failingCycleKeepsTrigger() {
            when(refreshOrchestrator.tryRunRefreshCycle(RefreshTrigger.SCHEDULED))
                    .thenThrow(new IllegalStateException("unexpected"));
            refreshScheduler.start();

            dailyTask().run();

            verify(future, never()).cancel(false);
            assertThat(refreshScheduler.getNextRunAt()).contains(Instant.parse("2024-03-02T06:00:00Z"));
            assertThat(refreshScheduler.getState()).isEqualTo(SchedulerState.IDLE);
        }

        @Test
        @DisplayName("A skipped cycle keeps the next run")
        void skippedCycleKeepsNextRun() {
            when(refreshOrchestrator.tryRunRefreshCycle(RefreshTrigger.SCHEDULED)).thenReturn(Optional.empty());
            refreshScheduler.start();

            dailyTask().run();

            verify(refreshOrchestrator).tryRunRefreshCycle(RefreshTrigger.SCHEDULED);
            verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Trigger.class));
            assertThat(refreshScheduler.getNextRunAt()).isPresent();
        }

        @Test
        @DisplayName("A task firing after stop does nothing")
        void taskAfterStop() {
            refreshScheduler.start();
            Runnable task = dailyTask();
            refreshScheduler.stop();

            task.run();

            verify(refreshOrchestrator, never()).tryRunRefreshCycle(any());
            assertThat(refreshScheduler.getNextRunAt()).isEmpty();
        }

        @Test
        @DisplayName("State stays RUNNING while a queued manual cycle outlives the scheduled one")
        void overlappingCyclesReportRunning() throws Exception {
            CountDownLatch manualExecuting = new CountDownLatch(1);
            CountDownLatch releaseManual = new CountDownLatch(1);
            when(refreshOrchestrator.tryRunRefreshCycle(RefreshTrigger.SCHEDULED)).thenReturn(Optional.of(record()));
            when(refreshOrchestrator.runRefreshCycle(RefreshTrigger.MANUAL)).thenAnswer(invocation -> {
                manualExecuting.countDown();
                releaseManual.await(5, TimeUnit.SECONDS);
                return record();
            });
            refreshScheduler.start();
            Runnable scheduled = dailyTask();

            Thread manual = new Thread(refreshScheduler::triggerNow);
            manual.start();
            assertThat(manualExecuting.await(5, TimeUnit.SECONDS)).isTrue();

            scheduled.run();
            assertThat(refreshScheduler.getState()).isEqualTo(SchedulerState.RUNNING);

            releaseManual.countDown();
            manual.join(5000);
            assertThat(manual.isAlive()).isFalse();
            assertThat(refreshScheduler.getState()).isEqualTo(SchedulerState.IDLE);
        }
    }

    @Test
    @DisplayName("triggerNow runs a MANUAL cycle without moving the daily schedule")
    void triggerNow() {
        when(refreshOrchestrator.runRefreshCycle(RefreshTrigger.MANUAL)).thenReturn(record());
        refreshScheduler.start();
        Optional<Instant> nextRun = refreshScheduler.getNextRunAt();

        RefreshRecord result = refreshScheduler.triggerNow();

        assertThat(result.getTrigger()).isEqualTo(RefreshTrigger.MANUAL);
        assertThat(refreshScheduler.getNextRunAt()).isEqualTo(nextRun);
        assertThat(refreshScheduler.getState()).isEqualTo(SchedulerState.IDLE);
        verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Trigger.class));
    }

    private Runnable dailyTask() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(task.capture(), any(Trigger.class));
        return task.getValue();
    }

    private static RefreshRecord record() {
        return RefreshRecord.builder()
                .id(1L)
                .runAt(NOW)
                .status(RefreshStatus.SUCCESS)
                .trigger(RefreshTrigger.MANUAL)
                .source("NYSE")
                .build();
    }
}

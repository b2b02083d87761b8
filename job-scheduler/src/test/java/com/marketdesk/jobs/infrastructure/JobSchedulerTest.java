package com.marketdesk.jobs.infrastructure;

import com.marketdesk.jobs.config.JobCatalog;
import com.marketdesk.jobs.config.JobsProperties;
import com.marketdesk.jobs.domain.JobDefinition;
import com.marketdesk.jobs.domain.MarketBoundary;
import com.marketdesk.jobs.service.CikBackfillService;
import com.marketdesk.jobs.service.JobRegistry;
import com.marketdesk.jobs.service.JobRunner;
import com.marketdesk.jobs.service.SecuritiesReconciler;
import com.marketdesk.jobs.service.SecurityDetailsService;
import com.marketdesk.jobs.service.StaleTaskReaper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for boundary firing and job ordering in the scheduler loop.
 */
@ExtendWith(MockitoExtension.class)
class JobSchedulerTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    // Friday
    private static final LocalDate WEEKDAY = LocalDate.of(2024, 3, 1);
    private static final LocalDate SATURDAY = LocalDate.of(2024, 3, 2);

    @Mock
    private JobRunner jobRunner;

    @Mock
    private TaskQueue taskQueue;

    @Mock
    private JobStatusStore statusStore;

    @Mock
    private ScheduledExecutorService executor;

    @Mock
    private BackgroundService backgroundService;

    private JobRegistry registry;
    private JobsProperties.Scheduler settings;
    private JobScheduler scheduler;

    @BeforeEach
    void setUp() {
        registry = new JobCatalog().jobRegistry(taskQueue, mock(SecuritiesReconciler.class),
                mock(CikBackfillService.class), mock(SecurityDetailsService.class), mock(StaleTaskReaper.class));
        settings = new JobsProperties.Scheduler();
        settings.setQueueStatusEveryTicks(0);
        scheduler = new JobScheduler(registry, jobRunner, taskQueue, statusStore, List.of(backgroundService),
                executor, Clock.system(NEW_YORK), settings);
    }

    private static ZonedDateTime at(LocalDate date, int hour, int minute) {
        return ZonedDateTime.of(date, LocalTime.of(hour, minute), NEW_YORK);
    }

    private List<String> ranJobs() {
        ArgumentCaptor<JobDefinition> captor = ArgumentCaptor.forClass(JobDefinition.class);
        verify(jobRunner, atLeast(0)).run(captor.capture(), any());
        return captor.getAllValues().stream().map(JobDefinition::getName).toList();
    }

    @Test
    void testJobsFor_CloseBoundaryOrderedFromCloseTime() {
        // Act
        List<String> names = scheduler.jobsFor(MarketBoundary.CLOSE).stream().map(JobDefinition::getName).toList();

        // Assert
        assertThat(names).containsExactly(
                JobCatalog.REAP_STALE_TASKS,
                JobCatalog.UPDATE_SECTORS,
                JobCatalog.UPDATE_MARKET_METRICS,
                JobCatalog.SIMPLE_UPDATE_SECURITIES,
                JobCatalog.UPDATE_SECURITIES,
                JobCatalog.UPDATE_SECURITY_DETAILS,
                JobCatalog.UPDATE_SECURITY_CIK);
    }

    @Test
    void testJobsFor_OpenBoundaryClearsQueueFirst() {
        // Act
        List<String> names = scheduler.jobsFor(MarketBoundary.OPEN).stream().map(JobDefinition::getName).toList();

        // Assert
        assertThat(names).containsExactly(JobCatalog.CLEAR_WORKER_QUEUE, JobCatalog.REAP_STALE_TASKS,
                JobCatalog.UPDATE_MARKET_METRICS);
    }

    @Test
    void testTick_OpenFiresOncePerDay() {
        // Act
        Optional<MarketBoundary> first = scheduler.tick(at(WEEKDAY, 4, 0));
        Optional<MarketBoundary> second = scheduler.tick(at(WEEKDAY, 4, 1));
        Optional<MarketBoundary> third = scheduler.tick(at(WEEKDAY, 12, 0));

        // Assert
        assertEquals(Optional.of(MarketBoundary.OPEN), first);
        assertTrue(second.isEmpty());
        assertTrue(third.isEmpty());
        assertThat(ranJobs()).containsExactly(JobCatalog.CLEAR_WORKER_QUEUE, JobCatalog.REAP_STALE_TASKS,
                JobCatalog.UPDATE_MARKET_METRICS);
    }

    @Test
    void testTick_CloseRunsJobsInScheduleOrder() {
        // Arrange
        scheduler.tick(at(WEEKDAY, 10, 0));
        clearInvocations(jobRunner);

        // Act
        Optional<MarketBoundary> fired = scheduler.tick(at(WEEKDAY, 20, 0));

        // Assert
        assertEquals(Optional.of(MarketBoundary.CLOSE), fired);
        InOrder inOrder = inOrder(jobRunner);
        for (String name : List.of(JobCatalog.REAP_STALE_TASKS, JobCatalog.UPDATE_SECTORS,
                JobCatalog.UPDATE_MARKET_METRICS, JobCatalog.SIMPLE_UPDATE_SECURITIES,
                JobCatalog.UPDATE_SECURITIES, JobCatalog.UPDATE_SECURITY_DETAILS, JobCatalog.UPDATE_SECURITY_CIK)) {
            inOrder.verify(jobRunner).run(eq(registry.getRequired(name)), eq("CLOSE"));
        }
    }

    @Test
    void testTick_WeekendSkipsWeekdayOnlyJobs() {
        // Act
        scheduler.tick(at(SATURDAY, 20, 0));

        // Assert
        assertThat(ranJobs()).containsExactly(JobCatalog.REAP_STALE_TASKS);
    }

    @Test
    void testTick_LogsQueueStatusEveryNTicks() {
        // Arrange
        settings.setQueueStatusEveryTicks(2);
        when(taskQueue.depth()).thenReturn(3L);

        // Act
        scheduler.tick(at(WEEKDAY, 12, 0));
        scheduler.tick(at(WEEKDAY, 12, 1));
        scheduler.tick(at(WEEKDAY, 12, 2));

        // Assert
        verify(taskQueue, times(1)).depth();
        verify(taskQueue, times(1)).pending(anyInt());
        assertEquals(3, scheduler.getTickCount());
    }

    @Test
    void testStart_InitializesOnce() {
        // Act
        scheduler.start();
        scheduler.start();

        // Assert
        verify(backgroundService, times(1)).start();
        verify(executor, times(1)).execute(any(Runnable.class));
        verify(executor, times(1)).scheduleWithFixedDelay(any(Runnable.class), eq(0L), anyLong(),
                eq(TimeUnit.MILLISECONDS));
        verify(statusStore, atLeastOnce()).findLastRun(any());
    }

    @Test
    void testStart_InitJobsIgnoreWeekendSkip() {
        // Arrange
        ArgumentCaptor<Runnable> initJobs = ArgumentCaptor.forClass(Runnable.class);
        scheduler.start();
        verify(executor).execute(initJobs.capture());

        // Act
        initJobs.getValue().run();

        // Assert
        assertThat(ranJobs()).containsExactlyInAnyOrder(JobCatalog.CLEAR_WORKER_QUEUE,
                JobCatalog.SIMPLE_UPDATE_SECURITIES, JobCatalog.UPDATE_SECURITY_DETAILS, JobCatalog.REAP_STALE_TASKS);
    }

    @Test
    void testStop_StopsBackgroundServicesOnce() {
        // Arrange
        scheduler.start();

        // Act
        scheduler.stop();
        scheduler.stop();

        // Assert
        verify(backgroundService, times(1)).stop();
    }
}

package com.marketdesk.jobs.config;

import com.marketdesk.jobs.domain.JobContext;
import com.marketdesk.jobs.domain.JobDefinition;
import com.marketdesk.jobs.domain.Task;
import com.marketdesk.jobs.domain.TaskStatus;
import com.marketdesk.jobs.infrastructure.TaskQueue;
import com.marketdesk.jobs.service.CikBackfillService;
import com.marketdesk.jobs.service.JobRegistry;
import com.marketdesk.jobs.service.SecuritiesReconciler;
import com.marketdesk.jobs.service.SecurityDetailsService;
import com.marketdesk.jobs.service.StaleTaskReaper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobCatalogTest {

    @Mock
    private TaskQueue taskQueue;

    @Mock
    private SecuritiesReconciler securitiesReconciler;

    @Mock
    private CikBackfillService cikBackfillService;

    @Mock
    private SecurityDetailsService securityDetailsService;

    @Mock
    private StaleTaskReaper staleTaskReaper;

    @Mock
    private JobContext context;

    private JobRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new JobCatalog().jobRegistry(taskQueue, securitiesReconciler, cikBackfillService,
                securityDetailsService, staleTaskReaper);
    }

    private static Task finished(TaskStatus status, String error) {
        Task task = Task.queued("sectors-1", "update_sectors", Map.of(), Instant.EPOCH);
        task.transitionTo(TaskStatus.RUNNING, Instant.EPOCH);
        if (status != TaskStatus.RUNNING) {
            task.transitionTo(status, Instant.EPOCH);
        }
        task.setError(error);
        return task;
    }

    @Test
    void testCatalog_RegistersDailyJobs() {
        // Assert
        assertEquals(8, registry.size());
        assertThat(registry.getRequired(JobCatalog.UPDATE_MARKET_METRICS).getSchedule())
                .containsExactly(LocalTime.of(8, 0), LocalTime.of(20, 30));
        assertTrue(registry.getRequired(JobCatalog.CLEAR_WORKER_QUEUE).isRunOnInit());
        assertFalse(registry.getRequired(JobCatalog.REAP_STALE_TASKS).isSkipOnWeekends());
    }

    @Test
    void testUpdateSecurityDetails_RunsAfterHistoryUpdate() throws Exception {
        // Arrange
        JobDefinition job = registry.getRequired(JobCatalog.UPDATE_SECURITY_DETAILS);

        // Act
        job.getFunction().run(context);

        // Assert
        verify(securityDetailsService).updateActiveSecurities();
        assertTrue(job.isRunOnInit());
        assertTrue(job.isSkipOnWeekends());
        assertThat(job.getSchedule().get(0))
                .isAfter(registry.getRequired(JobCatalog.UPDATE_SECURITIES).getSchedule().get(0));
    }

    @Test
    void testClearWorkerQueue_ClearsQueue() throws Exception {
        // Act
        registry.getRequired(JobCatalog.CLEAR_WORKER_QUEUE).getFunction().run(context);

        // Assert
        verify(taskQueue).clear();
    }

    @Test
    void testUpdateSectors_CompletedTaskSucceeds() throws Exception {
        // Arrange
        JobDefinition job = registry.getRequired(JobCatalog.UPDATE_SECTORS);
        when(context.enqueue(eq("update_sectors"), anyMap())).thenReturn("sectors-1");
        when(context.awaitTask(eq("sectors-1"), any(), any())).thenReturn(finished(TaskStatus.COMPLETED, null));

        // Act & Assert
        assertDoesNotThrow(() -> job.getFunction().run(context));
    }

    @Test
    void testUpdateSectors_FailedTaskFailsJob() throws Exception {
        // Arrange
        JobDefinition job = registry.getRequired(JobCatalog.UPDATE_SECTORS);
        when(context.enqueue(eq("update_sectors"), anyMap())).thenReturn("sectors-1");
        when(context.awaitTask(eq("sectors-1"), any(), any()))
                .thenReturn(finished(TaskStatus.FAILED, "sector source down"));

        // Act
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> job.getFunction().run(context));

        // Assert
        assertThat(ex.getMessage()).contains("failed").contains("sector source down");
    }

    @Test
    void testUpdateSectors_TimeoutFailsJob() throws Exception {
        // Arrange
        JobDefinition job = registry.getRequired(JobCatalog.UPDATE_SECTORS);
        when(context.enqueue(eq("update_sectors"), anyMap())).thenReturn("sectors-1");
        when(context.awaitTask(eq("sectors-1"), any(), any())).thenReturn(finished(TaskStatus.RUNNING, null));

        // Act
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> job.getFunction().run(context));

        // Assert
        assertThat(ex.getMessage()).contains("did not finish");
    }
}

package com.marketdesk.jobs.cli;

import com.marketdesk.jobs.config.JobsProperties;
import com.marketdesk.jobs.domain.JobDefinition;
import com.marketdesk.jobs.domain.JobExecution;
import com.marketdesk.jobs.domain.QueueEnvelope;
import com.marketdesk.jobs.domain.Task;
import com.marketdesk.jobs.domain.TaskLogEntry;
import com.marketdesk.jobs.domain.TaskStatus;
import com.marketdesk.jobs.exception.TaskNotFoundException;
import com.marketdesk.jobs.infrastructure.JobStatusStore;
import com.marketdesk.jobs.infrastructure.TaskQueue;
import com.marketdesk.jobs.service.JobRegistry;
import com.marketdesk.jobs.service.JobRunner;
import com.marketdesk.jobs.service.TaskMonitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the jobctl commands.
 */
@ExtendWith(MockitoExtension.class)
class JobControlCliTest {

    private static final Instant NOW = Instant.parse("2024-03-01T21:00:00Z");

    @Mock
    private JobRunner jobRunner;

    @Mock
    private TaskQueue taskQueue;

    @Mock
    private TaskMonitor taskMonitor;

    @Mock
    private JobStatusStore statusStore;

    private JobRegistry registry;
    private ByteArrayOutputStream buffer;
    private JobControlCli cli;

    @BeforeEach
    void setUp() {
        registry = new JobRegistry();
        registry.register(JobDefinition.builder().name("UpdateSectors").at(LocalTime.of(20, 15))
                .skipOnWeekends(true).function(context -> { }).build());
        registry.register(JobDefinition.builder().name("ClearWorkerQueue").at(LocalTime.of(3, 55))
                .runOnInit(true).function(context -> { }).build());

        buffer = new ByteArrayOutputStream();
        cli = new JobControlCli(registry, jobRunner, taskQueue, taskMonitor, statusStore, new JobsProperties.Cli(),
                Clock.fixed(NOW, ZoneId.of("America/New_York")),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static Task task(String id, TaskStatus status, String error) {
        Task task = Task.queued(id, "update_sectors", Map.of(), NOW);
        if (status != TaskStatus.QUEUED) {
            task.transitionTo(TaskStatus.RUNNING, NOW);
        }
        if (status.isTerminal()) {
            task.transitionTo(status, NOW);
        }
        task.setError(error);
        return task;
    }

    private static JobExecution completed(String... taskIds) {
        return JobExecution.builder().jobName("UpdateSectors").outcome(JobExecution.Outcome.COMPLETED)
                .startedAt(NOW).duration(Duration.ofMillis(12)).enqueuedTaskIds(List.of(taskIds)).build();
    }

    @Test
    void testList_PrintsJobsSortedByName() {
        // Act
        int code = cli.execute(new String[] {"list"});

        // Assert
        assertEquals(0, code);
        String out = output();
        assertThat(out).contains("NAME", "ClearWorkerQueue", "UpdateSectors", "20:15");
        assertThat(out.indexOf("ClearWorkerQueue")).isLessThan(out.indexOf("UpdateSectors"));
    }

    @Test
    void testStatus_UnknownJobFails() {
        assertEquals(1, cli.execute(new String[] {"status", "Nope"}));
        assertThat(output()).contains("Unknown job: Nope");
    }

    @Test
    void testStatus_ShowsTimestampsInSchedulerZone() {
        // Arrange
        when(statusStore.findLastRun("UpdateSectors")).thenReturn(Optional.of(Instant.parse("2024-03-01T01:15:00Z")));
        when(statusStore.findLastCompletion("UpdateSectors")).thenReturn(Optional.empty());

        // Act
        int code = cli.execute(new String[] {"status", "UpdateSectors"});

        // Assert
        assertEquals(0, code);
        assertThat(output()).contains("2024-02-29 20:15:00").contains("never");
    }

    @Test
    void testRun_WaitsForEnqueuedTasksAndPrintsLogs() throws Exception {
        // Arrange
        when(jobRunner.run(any(JobDefinition.class), eq("jobctl"))).thenReturn(completed("task-1"));
        when(taskMonitor.awaitAll(eq(List.of("task-1")), eq(Duration.ofSeconds(60)), any(), any()))
                .thenAnswer(invocation -> {
                    BiConsumer<String, TaskLogEntry> onLog = invocation.getArgument(3);
                    onLog.accept("task-1", new TaskLogEntry(NOW, "info", "sectors refreshed"));
                    Map<String, Task> result = new LinkedHashMap<>();
                    result.put("task-1", task("task-1", TaskStatus.COMPLETED, null));
                    return result;
                });

        // Act
        int code = cli.execute(new String[] {"run", "UpdateSectors", "--timeout", "60"});

        // Assert
        assertEquals(0, code);
        assertThat(output()).contains("sectors refreshed").contains("completed");
    }

    @Test
    void testRun_FailedTaskExitsNonZero() throws Exception {
        // Arrange
        when(jobRunner.run(any(JobDefinition.class), eq("jobctl"))).thenReturn(completed("task-1"));
        Map<String, Task> result = new LinkedHashMap<>();
        result.put("task-1", task("task-1", TaskStatus.FAILED, "boom"));
        when(taskMonitor.awaitAll(any(), any(), any(), any())).thenReturn(result);

        // Act
        int code = cli.execute(new String[] {"run", "UpdateSectors"});

        // Assert
        assertEquals(1, code);
        assertThat(output()).contains("failed").contains("boom");
    }

    @Test
    void testRun_TimeoutReportsIncompleteTasks() throws Exception {
        // Arrange
        when(jobRunner.run(any(JobDefinition.class), eq("jobctl"))).thenReturn(completed("task-1"));
        Map<String, Task> result = new LinkedHashMap<>();
        result.put("task-1", task("task-1", TaskStatus.RUNNING, null));
        when(taskMonitor.awaitAll(any(), any(), any(), any())).thenReturn(result);

        // Act
        int code = cli.execute(new String[] {"run", "UpdateSectors", "-t", "5"});

        // Assert
        assertEquals(1, code);
        assertThat(output()).contains("Timed out after 5s").contains("task-1");
        verify(taskQueue, never()).cancel(anyString());
    }

    @Test
    void testRun_TaskVanishingWhileWaitingExitsNonZero() throws Exception {
        // Arrange
        when(jobRunner.run(any(JobDefinition.class), eq("jobctl"))).thenReturn(completed("task-1"));
        when(taskMonitor.awaitAll(any(), any(), any(), any())).thenThrow(new TaskNotFoundException("task-1"));

        // Act
        int code = cli.execute(new String[] {"run", "UpdateSectors"});

        // Assert
        assertEquals(1, code);
        assertThat(output()).contains("Task not found: task-1");
    }

    @Test
    void testRun_NoWaitSkipsMonitoring() throws Exception {
        // Arrange
        when(jobRunner.run(any(JobDefinition.class), eq("jobctl"))).thenReturn(completed("task-1"));

        // Act
        int code = cli.execute(new String[] {"run", "UpdateSectors", "--no-wait"});

        // Assert
        assertEquals(0, code);
        assertThat(output()).contains("Enqueued task task-1");
        verifyNoInteractions(taskMonitor);
    }

    @Test
    void testRun_FailedJobExitsNonZero() {
        // Arrange
        when(jobRunner.run(any(JobDefinition.class), eq("jobctl"))).thenReturn(JobExecution.builder()
                .jobName("UpdateSectors").outcome(JobExecution.Outcome.FAILED).startedAt(NOW)
                .duration(Duration.ZERO).error("provider down").build());

        // Act
        int code = cli.execute(new String[] {"run", "UpdateSectors"});

        // Assert
        assertEquals(1, code);
        assertThat(output()).contains("provider down");
    }

    @Test
    void testRun_MissingNameFails() {
        assertEquals(1, cli.execute(new String[] {"run"}));
        assertThat(output()).contains("Missing argument for run");
    }

    @Test
    void testRun_InvalidTimeoutFails() {
        assertEquals(1, cli.execute(new String[] {"run", "UpdateSectors", "--timeout", "soon"}));
        assertThat(output()).contains("Invalid timeout: soon");
        verifyNoInteractions(jobRunner);
    }

    @Test
    void testQueue_ShowsPreviewAndRemainder() {
        // Arrange
        List<QueueEnvelope> pending = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            pending.add(QueueEnvelope.builder().id("t-" + i).func("update_active").args(Map.of()).build());
        }
        when(taskQueue.depth()).thenReturn(13L);
        when(taskQueue.pending(10)).thenReturn(pending);

        // Act
        int code = cli.execute(new String[] {"queue"});

        // Assert
        assertEquals(0, code);
        assertThat(output()).contains("Queue depth: 13").contains("t-9").contains("... and 3 more");
    }

    @Test
    void testMonitor_CompletedTask() throws Exception {
        // Arrange
        when(taskMonitor.await(eq("task-1"), any(), any(), any()))
                .thenReturn(task("task-1", TaskStatus.COMPLETED, null));

        // Act
        int code = cli.execute(new String[] {"monitor", "task-1"});

        // Assert
        assertEquals(0, code);
        assertThat(output()).contains("Task task-1 (update_sectors): completed");
    }

    @Test
    void testMonitor_UnknownTaskFails() throws Exception {
        // Arrange
        when(taskMonitor.await(eq("nope"), any(), any(), any())).thenThrow(new TaskNotFoundException("nope"));

        // Act & Assert
        assertEquals(1, cli.execute(new String[] {"monitor", "nope"}));
        assertThat(output()).contains("Task not found: nope");
    }

    @Test
    void testCancel_QueuedTask() {
        when(taskQueue.cancel("task-1")).thenReturn(true);
        assertEquals(0, cli.execute(new String[] {"cancel", "task-1"}));
        assertThat(output()).contains("Cancelled task task-1");
    }

    @Test
    void testCancel_RunningTaskRefused() {
        // Arrange
        when(taskQueue.cancel("task-1")).thenReturn(false);
        when(taskQueue.poll("task-1")).thenReturn(task("task-1", TaskStatus.RUNNING, null));

        // Act & Assert
        assertEquals(1, cli.execute(new String[] {"cancel", "task-1"}));
        assertThat(output()).contains("is running");
    }

    @Test
    void testHelp_ExitsZero() {
        assertEquals(0, cli.execute(new String[] {"help"}));
        assertThat(output()).contains("--no-wait").contains("--timeout");
    }

    @Test
    void testUnknownCommandFails() {
        assertEquals(1, cli.execute(new String[] {"explode"}));
        assertThat(output()).contains("Unknown command: explode");
    }

    @Test
    void testNoArgumentsFails() {
        assertEquals(1, cli.execute(new String[0]));
    }
}

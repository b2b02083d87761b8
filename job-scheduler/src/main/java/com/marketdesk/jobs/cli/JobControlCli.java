package com.marketdesk.jobs.cli;

import com.marketdesk.jobs.config.JobsProperties;
import com.marketdesk.jobs.domain.JobDefinition;
import com.marketdesk.jobs.domain.JobExecution;
import com.marketdesk.jobs.domain.QueueEnvelope;
import com.marketdesk.jobs.domain.Task;
import com.marketdesk.jobs.domain.TaskLogEntry;
import com.marketdesk.jobs.domain.TaskStatus;
import com.marketdesk.jobs.exception.TaskNotFoundException;
import com.marketdesk.jobs.exception.TaskQueueException;
import com.marketdesk.jobs.infrastructure.JobStatusStore;
import com.marketdesk.jobs.infrastructure.TaskQueue;
import com.marketdesk.jobs.service.JobRegistry;
import com.marketdesk.jobs.service.JobRunner;
import com.marketdesk.jobs.service.TaskMonitor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * jobctl: operator commands for listing, running and following jobs and tasks.
 * Returns 0 on success and 1 on any failure.
 */
@Component
@Slf4j
public class JobControlCli {

    static final String USAGE = "jobctl <list|status [name]|run <name>|queue|monitor <taskId>|cancel <taskId>|help>";
    private static final int QUEUE_PREVIEW = 10;
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final JobRegistry jobRegistry;
    private final JobRunner jobRunner;
    private final TaskQueue taskQueue;
    private final TaskMonitor taskMonitor;
    private final JobStatusStore statusStore;
    private final JobsProperties.Cli settings;
    private final Clock clock;
    private final PrintStream out;

    @Autowired
    public JobControlCli(JobRegistry jobRegistry, JobRunner jobRunner, TaskQueue taskQueue, TaskMonitor taskMonitor,
            JobStatusStore statusStore, JobsProperties properties, Clock clock) {
        this(jobRegistry, jobRunner, taskQueue, taskMonitor, statusStore, properties.getCli(), clock, System.out);
    }

    JobControlCli(JobRegistry jobRegistry, JobRunner jobRunner, TaskQueue taskQueue, TaskMonitor taskMonitor,
            JobStatusStore statusStore, JobsProperties.Cli settings, Clock clock, PrintStream out) {
        this.jobRegistry = jobRegistry;
        this.jobRunner = jobRunner;
        this.taskQueue = taskQueue;
        this.taskMonitor = taskMonitor;
        this.statusStore = statusStore;
        this.settings = settings;
        this.clock = clock;
        this.out = out;
    }

    /**
     * Parse and run one command.
     *
     * @return the process exit code
     */
    public int execute(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            out.println("Error: " + e.getMessage());
            printHelp(options);
            return 1;
        }

        List<String> arguments = cmd.getArgList();
        if (cmd.hasOption("help") || (!arguments.isEmpty() && "help".equals(arguments.get(0)))) {
            printHelp(options);
            return 0;
        }
        if (arguments.isEmpty()) {
            printHelp(options);
            return 1;
        }

        String command = arguments.get(0);
        String target = arguments.size() > 1 ? arguments.get(1) : null;

        try {
            Duration timeout = timeout(cmd);
            switch (command) {
                case "list":
                    return list();
                case "status":
                    return status(target);
                case "run":
                    return requireArgument(command, target) ? run(target, timeout, cmd.hasOption("no-wait")) : 1;
                case "queue":
                    return queue();
                case "monitor":
                    return requireArgument(command, target) ? monitor(target, timeout) : 1;
                case "cancel":
                    return requireArgument(command, target) ? cancel(target) : 1;
                default:
                    out.println("Unknown command: " + command);
                    printHelp(options);
                    return 1;
            }
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            return 1;
        } catch (TaskNotFoundException e) {
            // A task enqueued by run can disappear before it is followed
            out.println("Task not found: " + e.getTaskId());
            return 1;
        } catch (TaskQueueException e) {
            log.debug("Queue failure", e);
            out.println("Error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.println("Interrupted");
            return 1;
        }
    }

    private int list() {
        TableWriter table = new TableWriter("NAME", "SCHEDULE", "WEEKENDS", "ON INIT", "RUNNING");
        for (JobDefinition job : jobRegistry.list()) {
            table.row(job.getName(),
                    job.getSchedule().stream().map(Object::toString).collect(Collectors.joining(",")),
                    job.isSkipOnWeekends() ? "skip" : "run",
                    job.isRunOnInit() ? "yes" : "no",
                    job.isRunning() ? "yes" : "no");
        }
        table.print(out);
        return 0;
    }

    private int status(String name) {
        List<JobDefinition> jobs;
        if (name == null) {
            jobs = jobRegistry.list();
        } else {
            Optional<JobDefinition> job = jobRegistry.find(name);
            if (job.isEmpty()) {
                out.println("Unknown job: " + name);
                return 1;
            }
            jobs = List.of(job.get());
        }

        TableWriter table = new TableWriter("NAME", "LAST RUN", "LAST COMPLETION");
        for (JobDefinition job : jobs) {
            table.row(job.getName(),
                    formatTime(statusStore.findLastRun(job.getName())),
                    formatTime(statusStore.findLastCompletion(job.getName())));
        }
        table.print(out);
        return 0;
    }

    private int run(String name, Duration timeout, boolean noWait) throws InterruptedException {
        Optional<JobDefinition> job = jobRegistry.find(name);
        if (job.isEmpty()) {
            out.println("Unknown job: " + name);
            return 1;
        }

        out.println("Running " + name + "...");
        JobExecution execution = jobRunner.run(job.get(), "jobctl");
        switch (execution.getOutcome()) {
            case SKIPPED:
                out.println("Job " + name + " is already running");
                return 1;
            case FAILED:
                out.println("Job " + name + " failed: " + execution.getError());
                return 1;
            default:
                out.println("Job " + name + " completed in " + execution.getDuration().toMillis() + "ms");
        }

        List<String> taskIds = execution.getEnqueuedTaskIds();
        if (taskIds.isEmpty()) {
            return 0;
        }
        if (noWait) {
            taskIds.forEach(id -> out.println("Enqueued task " + id));
            return 0;
        }

        out.println("Waiting up to " + timeout.toSeconds() + "s for " + taskIds.size() + " task(s)");
        Map<String, Task> tasks = taskMonitor.awaitAll(taskIds, timeout, settings.getPollInterval(), this::printLog);
        return reportTasks(tasks, timeout);
    }

    private int reportTasks(Map<String, Task> tasks, Duration timeout) {
        TableWriter table = new TableWriter("TASK", "FUNCTION", "STATUS", "ERROR");
        boolean ok = true;
        List<String> incomplete = tasks.values().stream()
                .filter(task -> !task.isTerminal())
                .map(Task::getId)
                .toList();
        for (Task task : tasks.values()) {
            table.row(task.getId(), task.getFunction(), task.getStatus().getValue(), task.getError());
            ok &= task.getStatus() == TaskStatus.COMPLETED;
        }
        table.print(out);

        if (!incomplete.isEmpty()) {
            out.println("Timed out after " + timeout.toSeconds() + "s; still incomplete: "
                    + String.join(", ", incomplete));
        }
        return ok ? 0 : 1;
    }

    private int queue() {
        long depth = taskQueue.depth();
        out.println("Queue depth: " + depth);
        if (depth == 0) {
            return 0;
        }

        TableWriter table = new TableWriter("TASK", "FUNCTION", "ARGS");
        for (QueueEnvelope envelope : taskQueue.pending(QUEUE_PREVIEW)) {
            table.row(envelope.getId(), envelope.getFunc(), envelope.getArgs());
        }
        table.print(out);
        if (depth > QUEUE_PREVIEW) {
            out.println("... and " + (depth - QUEUE_PREVIEW) + " more");
        }
        return 0;
    }

    private int monitor(String taskId, Duration timeout) throws InterruptedException {
        Task task;
        try {
            task = taskMonitor.await(taskId, timeout, settings.getPollInterval(), this::printLog);
        } catch (TaskNotFoundException e) {
            out.println("Task not found: " + taskId);
            return 1;
        }

        out.println("Task " + taskId + " (" + task.getFunction() + "): " + task.getStatus().getValue());
        if (task.getResult() != null) {
            out.println("Result: " + task.getResult());
        }
        if (task.getError() != null) {
            out.println("Error: " + task.getError());
        }
        if (!task.isTerminal()) {
            out.println("Timed out after " + timeout.toSeconds() + "s");
            return 1;
        }
        return task.getStatus() == TaskStatus.COMPLETED ? 0 : 1;
    }

    private int cancel(String taskId) {
        try {
            if (taskQueue.cancel(taskId)) {
                out.println("Cancelled task " + taskId);
                return 0;
            }
            out.println("Task " + taskId + " is " + taskQueue.poll(taskId).getStatus().getValue()
                    + "; only queued tasks can be cancelled");
            return 1;
        } catch (TaskNotFoundException e) {
            out.println("Task not found: " + taskId);
            return 1;
        }
    }

    private void printLog(String taskId, TaskLogEntry entry) {
        out.printf("[%s] %-5s %s%n", shortId(taskId), entry.getLevel(), entry.getMessage());
    }

    private boolean requireArgument(String command, String argument) {
        if (argument == null) {
            out.println("Missing argument for " + command);
            out.println("Usage: " + USAGE);
            return false;
        }
        return true;
    }

    private Duration timeout(CommandLine cmd) {
        String value = cmd.getOptionValue("timeout");
        if (value == null) {
            return settings.getTimeout();
        }
        try {
            long seconds = Long.parseLong(value);
            if (seconds <= 0) {
                throw new IllegalArgumentException("Timeout must be positive: " + value);
            }
            return Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid timeout: " + value, e);
        }
    }

    private String formatTime(Optional<Instant> instant) {
        return instant.map(value -> TIMESTAMP.format(value.atZone(clock.getZone()))).orElse("never");
    }

    private static String shortId(String taskId) {
        return taskId.length() > 8 ? taskId.substring(0, 8) : taskId;
    }

    private void printHelp(Options options) {
        PrintWriter writer = new PrintWriter(out);
        new HelpFormatter().printHelp(writer, 100, USAGE, "Commands: list, status, run, queue, monitor, cancel, help",
                options, 2, 4, null);
        writer.flush();
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("t").longOpt("timeout").hasArg().argName("seconds")
                .desc("how long run/monitor wait for tasks (default 300)").build());
        options.addOption(Option.builder().longOpt("no-wait").desc("run: do not wait for enqueued tasks").build());
        options.addOption(Option.builder("h").longOpt("help").desc("show help").build());
        return options;
    }
}

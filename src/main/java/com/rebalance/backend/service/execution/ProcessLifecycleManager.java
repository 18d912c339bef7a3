package com.rebalance.backend.service.execution;

import com.rebalance.backend.config.ExecutionProperties;
import com.rebalance.backend.exception.TradingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts the run-scoped execution process and stops it once its run is over. The leader session pid is
 * never signalled.
 */
@Service
@Slf4j
public class ProcessLifecycleManager {

    public static final String OUTCOME_TERMINATED = "terminated";
    public static final String OUTCOME_KILL_REQUESTED = "kill_requested";
    public static final String OUTCOME_NOT_RUNNING = "not_running";
    public static final String OUTCOME_LEADER_PROTECTED = "leader_protected";

    static final String LOG_FILE = "log.txt";
    private static final Duration POLL_INTERVAL = Duration.ofMillis(250);

    private final ProcessControl processControl;
    private final TaskPoller taskPoller;
    private final ExecutionProperties executionProperties;
    private final Clock clock;
    private final Map<Long, CancellableTask> escalations = new ConcurrentHashMap<>();

    public ProcessLifecycleManager(ProcessControl processControl, TaskPoller taskPoller,
                                   ExecutionProperties executionProperties, Clock clock) {
        this.processControl = processControl;
        this.taskPoller = taskPoller;
        this.executionProperties = executionProperties;
        this.clock = clock;
    }

    public record LaunchedProcess(long pid, Path outputDir, Path configPath, Instant launchedAt) {
    }

    /**
     * Starts the launcher for one run and returns as soon as the process exists.
     * @throws TradingException when no launcher is configured or the process cannot be started
     */
    public LaunchedProcess launch(Long runId, Path configPath, Path outputDir) {
        List<String> template = executionProperties.getLauncherCommand();
        if (template == null || template.isEmpty()) {
            throw new TradingException("launcher_not_configured");
        }
        List<String> command = new ArrayList<>(template.size());
        for (String part : template) {
            command.add(part.replace("{config}", configPath.toAbsolutePath().toString())
                    .replace("{runId}", String.valueOf(runId)));
        }
        try {
            long pid = processControl.launch(command, outputDir, outputDir.resolve(LOG_FILE));
            log.info("Execution process launched runId={} pid={} outputDir={}", runId, pid, outputDir);
            return new LaunchedProcess(pid, outputDir, configPath, Instant.now(clock));
        } catch (IOException e) {
            throw new TradingException("launch_failed:" + e.getMessage(), e);
        }
    }

    /**
     * Requests termination of a run's process and escalates to a forced kill after the grace period.
     * @return one of the {@code OUTCOME_*} values
     */
    public String terminateIfRunning(Long runId, Long pid, Long leaderPid) {
        if (pid == null || !processControl.isAlive(pid)) {
            if (pid != null) {
                escalations.remove(pid);
            }
            return OUTCOME_NOT_RUNNING;
        }
        if (Objects.equals(pid, leaderPid)) {
            log.warn("Refusing to terminate leader process runId={} pid={}", runId, pid);
            return OUTCOME_LEADER_PROTECTED;
        }
        CancellableTask running = escalations.get(pid);
        if (running != null && !running.isCancelled()) {
            return OUTCOME_KILL_REQUESTED;
        }
        processControl.requestTerminate(pid);
        if (!processControl.isAlive(pid)) {
            escalations.remove(pid);
            log.info("Execution process terminated runId={} pid={}", runId, pid);
            return OUTCOME_TERMINATED;
        }
        Duration grace = Duration.ofSeconds(executionProperties.getTerminateGraceSeconds());
        CancellableTask task = taskPoller.pollUntil("terminate-" + pid,
                () -> {
                    boolean exited = !processControl.isAlive(pid);
                    if (exited) {
                        escalations.remove(pid);
                    }
                    return exited;
                },
                grace,
                POLL_INTERVAL,
                () -> {
                    log.warn("Process ignored termination, killing runId={} pid={}", runId, pid);
                    processControl.forceKill(pid);
                    escalations.remove(pid);
                });
        escalations.put(pid, task);
        // The first poll may have finished before the task was registered
        if (task.isCancelled()) {
            escalations.remove(pid, task);
        }
        log.info("Termination requested runId={} pid={} graceSeconds={}", runId, pid, grace.getSeconds());
        return OUTCOME_KILL_REQUESTED;
    }

    int pendingEscalations() {
        return escalations.size();
    }

    public boolean isAlive(Long pid) {
        return pid != null && processControl.isAlive(pid);
    }
}

package com.rebalance.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;

@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final AuditEventService auditEventService;

    public void run(String taskName, Long runId, Runnable task) {
        try {
            task.run();
        } catch (Throwable t) {
            log.error("Scheduled task failed task={} runId={}", taskName, runId, t);
            HashMap<String, Object> metadata = new HashMap<>();
            metadata.put("task", taskName);
            metadata.put("error", String.valueOf(t.getMessage()));
            auditEventService.recordEvent(runId, "scheduler", "TASK_FAILED",
                    "Scheduled task failed: " + taskName, metadata);
        }
    }
}

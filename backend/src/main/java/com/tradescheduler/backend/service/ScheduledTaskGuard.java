package com.tradescheduler.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs background work so that a failure is logged and counted instead of
 * killing the scheduling thread.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final MetricsService metricsService;

    public void run(String taskName, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Scheduled task failed task={} error={}", taskName, e.getMessage(), e);
            metricsService.recordTaskFailure(taskName);
        }
    }
}

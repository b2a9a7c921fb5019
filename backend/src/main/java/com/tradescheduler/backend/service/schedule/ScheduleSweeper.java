package com.tradescheduler.backend.service.schedule;

import com.tradescheduler.backend.config.SchedulerProperties;
import com.tradescheduler.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the trigger set once the application is up, then re-reconciles
 * periodically so drift and earlier failures heal without an API call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleSweeper {

    private final ScheduleRegistrar scheduleRegistrar;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final SchedulerProperties schedulerProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!schedulerProperties.getReconcile().isEnabled()) {
            log.info("Startup reconcile disabled");
            return;
        }
        scheduledTaskGuard.run("startup-reconcile", scheduleRegistrar::reconcile);
    }

    @Scheduled(fixedDelayString = "${scheduler.reconcile.sweep-interval-ms:60000}",
            initialDelayString = "${scheduler.reconcile.initial-delay-ms:30000}")
    public void sweep() {
        if (!schedulerProperties.getReconcile().isEnabled()) {
            return;
        }
        scheduledTaskGuard.run("reconcile-sweep", scheduleRegistrar::reconcile);
    }
}

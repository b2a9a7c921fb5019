package com.tradescheduler.backend.service.schedule;

import com.tradescheduler.backend.exception.InvalidScheduleException;
import com.tradescheduler.backend.exception.ReconciliationException;
import com.tradescheduler.backend.model.JobDefinition;
import com.tradescheduler.backend.service.JobStoreService;
import com.tradescheduler.backend.service.MetricsService;
import com.tradescheduler.backend.service.SettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Makes the engine's trigger set match the enabled jobs in the store.
 * <p>
 * Passes never overlap. Each pass reads the live triggers fresh and only
 * writes where the desired spec differs, so a pass over an unchanged store
 * performs no engine writes. A failed operation is recorded in the report and
 * left for the next pass.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleRegistrar {

    private final JobStoreService jobStoreService;
    private final SettingsService settingsService;
    private final ScheduleCompiler scheduleCompiler;
    private final ScheduleEngine scheduleEngine;
    private final MetricsService metricsService;

    private final ReentrantLock passLock = new ReentrantLock(true);

    /**
     * Reconciles against the store's current enabled jobs, read after the
     * pass lock is taken.
     */
    public ReconcileReport reconcile() {
        passLock.lock();
        try {
            return runPass(jobStoreService.listEnabled());
        } finally {
            passLock.unlock();
        }
    }

    /**
     * Reconciles against the given job list. Disabled entries are treated as
     * absent.
     */
    public ReconcileReport reconcile(List<JobDefinition> currentJobs) {
        passLock.lock();
        try {
            return runPass(currentJobs.stream().filter(JobDefinition::isEnabled).toList());
        } finally {
            passLock.unlock();
        }
    }

    private ReconcileReport runPass(List<JobDefinition> enabledJobs) {
        ZoneId zone = settingsService.getZone();
        Map<String, TriggerSpec> live = scheduleEngine.listTriggers();

        List<Failure> failures = new ArrayList<>();
        Map<String, TriggerSpec> desired = new LinkedHashMap<>();
        Set<String> uncompilable = new HashSet<>();
        for (JobDefinition job : enabledJobs) {
            try {
                desired.put(job.getName(), scheduleCompiler.compile(job.schedule(), zone));
            } catch (InvalidScheduleException ex) {
                // Leave whatever is registered for it in place.
                uncompilable.add(job.getName());
                failures.add(new Failure(job.getName(), "compile", ex.getMessage(), false));
                log.error("Job {} has an invalid stored schedule: {}", job.getName(), ex.getMessage());
            }
        }

        List<String> created = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        List<String> deleted = new ArrayList<>();
        int unchanged = 0;

        for (Map.Entry<String, TriggerSpec> entry : desired.entrySet()) {
            String name = entry.getKey();
            TriggerSpec current = live.get(name);
            if (entry.getValue().equals(current)) {
                unchanged++;
                continue;
            }
            try {
                scheduleEngine.upsertTrigger(name, entry.getValue());
                (current == null ? created : updated).add(name);
            } catch (ReconciliationException ex) {
                failures.add(new Failure(name, "upsert", ex.getMessage(), ex.isTimeout()));
                log.warn("Trigger upsert failed job={} timeout={} error={}", name, ex.isTimeout(), ex.getMessage());
            }
        }

        for (String name : live.keySet()) {
            if (desired.containsKey(name) || uncompilable.contains(name)) {
                continue;
            }
            try {
                scheduleEngine.deleteTrigger(name);
                deleted.add(name);
            } catch (ReconciliationException ex) {
                failures.add(new Failure(name, "delete", ex.getMessage(), ex.isTimeout()));
                log.warn("Trigger delete failed job={} timeout={} error={}", name, ex.isTimeout(), ex.getMessage());
            }
        }

        metricsService.recordReconcileOperation("create", created.size());
        metricsService.recordReconcileOperation("update", updated.size());
        metricsService.recordReconcileOperation("delete", deleted.size());
        failures.forEach(failure -> metricsService.incrementReconcileFailures());

        ReconcileReport report = new ReconcileReport(created, updated, deleted, unchanged, failures, Instant.now());
        if (report.hasChanges() || !failures.isEmpty()) {
            log.info("Reconcile pass zone={} created={} updated={} deleted={} unchanged={} failures={}",
                    zone.getId(), created, updated, deleted, unchanged, failures.size());
        } else {
            log.debug("Reconcile pass zone={} unchanged={}", zone.getId(), unchanged);
        }
        return report;
    }

    public record ReconcileReport(List<String> created,
                                  List<String> updated,
                                  List<String> deleted,
                                  int unchanged,
                                  List<Failure> failures,
                                  Instant completedAt) {

        public ReconcileReport {
            created = List.copyOf(created);
            updated = List.copyOf(updated);
            deleted = List.copyOf(deleted);
            failures = List.copyOf(failures);
        }

        public boolean hasChanges() {
            return !created.isEmpty() || !updated.isEmpty() || !deleted.isEmpty();
        }

        public boolean succeeded() {
            return failures.isEmpty();
        }
    }

    public record Failure(String jobName, String operation, String message, boolean timeout) {
    }
}

package com.tradescheduler.backend.service;

import com.tradescheduler.backend.exception.ConflictException;
import com.tradescheduler.backend.exception.NotFoundException;
import com.tradescheduler.backend.exception.ReconciliationException;
import com.tradescheduler.backend.model.ExecutionRecord;
import com.tradescheduler.backend.model.JobDefinition;
import com.tradescheduler.backend.service.schedule.ScheduleEngine;
import com.tradescheduler.backend.service.schedule.ScheduleRegistrar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for the management API. Store writes are followed by a
 * reconcile pass; a failing pass is logged and left to the sweeper, so the
 * caller of the write only sees the write's own result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobManagementService {

    private final JobStoreService jobStoreService;
    private final SettingsService settingsService;
    private final ScheduleRegistrar scheduleRegistrar;
    private final ScheduleEngine scheduleEngine;
    private final ExecutionRecordService executionRecordService;

    public List<JobDefinition> list() {
        return jobStoreService.list();
    }

    public JobDefinition get(String name) {
        return jobStoreService.get(name);
    }

    public JobDefinition create(JobDefinition job) {
        JobDefinition created = jobStoreService.create(job);
        reconcileAfterWrite("create " + created.getName());
        return created;
    }

    public JobDefinition update(String name, JobDefinition job) {
        JobDefinition updated = jobStoreService.update(name, job);
        reconcileAfterWrite("update " + name);
        return updated;
    }

    public void delete(String name) {
        jobStoreService.delete(name);
        reconcileAfterWrite("delete " + name);
    }

    /**
     * Fires the job once through the engine, so the run goes through the same
     * path and the same concurrency rules as a scheduled fire.
     */
    public void runNow(String name) {
        JobDefinition job = jobStoreService.get(name);
        if (!job.isEnabled()) {
            throw new ConflictException("Job '" + name + "' is disabled");
        }
        try {
            scheduleEngine.fireNow(job.getName());
        } catch (NotFoundException ex) {
            // Stored but not registered yet: register, then fire.
            reconcileAfterWrite("run " + name);
            scheduleEngine.fireNow(job.getName());
        }
    }

    public List<ExecutionRecord> executions(String name, Integer limit) {
        jobStoreService.get(name);
        return executionRecordService.listForJob(name, limit);
    }

    public List<ExecutionRecord> recentExecutions(Integer limit) {
        return executionRecordService.listRecent(limit);
    }

    public String getTimezone() {
        return settingsService.getTimezone();
    }

    public String updateTimezone(String timezone) {
        String stored = settingsService.updateTimezone(timezone);
        reconcileAfterWrite("timezone " + stored);
        return stored;
    }

    public List<ScheduleEngine.TriggerStatus> triggers() {
        return scheduleEngine.describeTriggers();
    }

    public ScheduleRegistrar.ReconcileReport reconcile() {
        return scheduleRegistrar.reconcile();
    }

    private void reconcileAfterWrite(String cause) {
        try {
            ScheduleRegistrar.ReconcileReport report = scheduleRegistrar.reconcile();
            if (!report.succeeded()) {
                log.warn("Reconcile after {} left {} failure(s); the sweeper will retry", cause,
                        report.failures().size());
            }
        } catch (ReconciliationException ex) {
            log.warn("Reconcile after {} failed timeout={} error={}; the sweeper will retry",
                    cause, ex.isTimeout(), ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Reconcile after {} failed unexpectedly; the sweeper will retry", cause, ex);
        }
    }
}

package com.tradescheduler.backend.service.schedule;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Boundary to the engine that owns the live trigger set and fires jobs. The
 * engine's trigger set is external state: callers re-query it instead of
 * caching it.
 */
public interface ScheduleEngine {

    /**
     * Live triggers keyed by job name.
     */
    Map<String, TriggerSpec> listTriggers();

    /**
     * Creates the trigger for {@code jobName}, or replaces the existing one.
     */
    void upsertTrigger(String jobName, TriggerSpec spec);

    void deleteTrigger(String jobName);

    /**
     * Fires the registered job once, now, outside its recurring schedule.
     */
    void fireNow(String jobName);

    List<TriggerStatus> describeTriggers();

    record TriggerStatus(String jobName, TriggerSpec spec, String state,
                         Instant nextFireTime, Instant previousFireTime) {
    }
}

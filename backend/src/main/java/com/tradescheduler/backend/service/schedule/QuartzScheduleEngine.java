package com.tradescheduler.backend.service.schedule;

import com.tradescheduler.backend.config.SchedulerProperties;
import com.tradescheduler.backend.exception.NotFoundException;
import com.tradescheduler.backend.exception.ReconciliationException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.quartz.CronScheduleBuilder;
import org.quartz.CronTrigger;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TimeZone;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * Quartz-backed engine. Each job name owns one durable Quartz job and one cron
 * trigger, both keyed by the job name inside the configured namespace group.
 */
@Slf4j
@Service
public class QuartzScheduleEngine implements ScheduleEngine {

    private final Scheduler scheduler;
    private final TimeLimiter engineTimeLimiter;
    private final Executor engineExecutor;
    private final String group;

    public QuartzScheduleEngine(Scheduler scheduler,
                                TimeLimiter engineTimeLimiter,
                                @Qualifier("engineExecutor") Executor engineExecutor,
                                SchedulerProperties properties) {
        this.scheduler = scheduler;
        this.engineTimeLimiter = engineTimeLimiter;
        this.engineExecutor = engineExecutor;
        this.group = properties.getEngine().getNamespace();
    }

    @Override
    public Map<String, TriggerSpec> listTriggers() {
        return call("list", null, () -> {
            Map<String, TriggerSpec> triggers = new LinkedHashMap<>();
            for (TriggerKey key : scheduler.getTriggerKeys(GroupMatcher.triggerGroupEquals(group))) {
                Trigger trigger = scheduler.getTrigger(key);
                if (trigger instanceof CronTrigger cronTrigger) {
                    triggers.put(key.getName(), toSpec(cronTrigger));
                }
            }
            return triggers;
        });
    }

    @Override
    public void upsertTrigger(String jobName, TriggerSpec spec) {
        call("upsert", jobName, () -> {
            JobKey jobKey = JobKey.jobKey(jobName, group);
            JobDetail jobDetail = JobBuilder.newJob(TradeExecutionJob.class)
                    .withIdentity(jobKey)
                    .withDescription("Trade job " + jobName)
                    .usingJobData(TradeExecutionJob.JOB_NAME_KEY, jobName)
                    .storeDurably()
                    .build();
            Trigger trigger = TriggerBuilder.newTrigger()
                    .withIdentity(TriggerKey.triggerKey(jobName, group))
                    .forJob(jobKey)
                    .withSchedule(CronScheduleBuilder.cronSchedule(spec.cronExpression())
                            .inTimeZone(TimeZone.getTimeZone(ZoneId.of(spec.timeZone())))
                            .withMisfireHandlingInstructionFireAndProceed())
                    .build();
            scheduler.scheduleJob(jobDetail, Set.of(trigger), true);
            log.info("Registered trigger job={} cron='{}' zone={}", jobName, spec.cronExpression(), spec.timeZone());
            return null;
        });
    }

    @Override
    public void deleteTrigger(String jobName) {
        call("delete", jobName, () -> {
            boolean removed = scheduler.deleteJob(JobKey.jobKey(jobName, group));
            if (!removed) {
                scheduler.unscheduleJob(TriggerKey.triggerKey(jobName, group));
            }
            log.info("Removed trigger job={}", jobName);
            return null;
        });
    }

    @Override
    public void fireNow(String jobName) {
        boolean fired = call("fire", jobName, () -> {
            JobKey jobKey = JobKey.jobKey(jobName, group);
            if (!scheduler.checkExists(jobKey)) {
                return false;
            }
            scheduler.triggerJob(jobKey);
            return true;
        });
        if (!fired) {
            throw new NotFoundException("No trigger registered for job '" + jobName + "'");
        }
        log.info("Fired job={} on demand", jobName);
    }

    @Override
    public List<TriggerStatus> describeTriggers() {
        return call("describe", null, () -> {
            List<TriggerStatus> statuses = new ArrayList<>();
            for (TriggerKey key : scheduler.getTriggerKeys(GroupMatcher.triggerGroupEquals(group))) {
                Trigger trigger = scheduler.getTrigger(key);
                if (!(trigger instanceof CronTrigger cronTrigger)) {
                    continue;
                }
                statuses.add(new TriggerStatus(
                        key.getName(),
                        toSpec(cronTrigger),
                        scheduler.getTriggerState(key).name(),
                        toInstant(cronTrigger.getNextFireTime()),
                        toInstant(cronTrigger.getPreviousFireTime())));
            }
            statuses.sort(Comparator.comparing(TriggerStatus::jobName));
            return statuses;
        });
    }

    private TriggerSpec toSpec(CronTrigger trigger) {
        TimeZone zone = trigger.getTimeZone();
        return new TriggerSpec(trigger.getCronExpression(), zone != null ? zone.getID() : null);
    }

    private Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    private <T> T call(String operation, String jobName, EngineCall<T> engineCall) {
        try {
            return engineTimeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(() -> {
                try {
                    return engineCall.run();
                } catch (SchedulerException ex) {
                    throw new CompletionException(ex);
                }
            }, engineExecutor));
        } catch (TimeoutException ex) {
            throw new ReconciliationException(describe(operation, jobName) + " timed out", ex, true);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ReconciliationException(describe(operation, jobName) + " interrupted", ex);
        } catch (RuntimeException ex) {
            throw new ReconciliationException(describe(operation, jobName) + " failed: " + ex.getMessage(), ex);
        } catch (Exception ex) {
            throw new ReconciliationException(describe(operation, jobName) + " failed: " + ex.getMessage(), ex);
        }
    }

    private String describe(String operation, String jobName) {
        return jobName == null
                ? "Schedule engine " + operation
                : "Schedule engine " + operation + " for job '" + jobName + "'";
    }

    @FunctionalInterface
    private interface EngineCall<T> {
        T run() throws SchedulerException;
    }
}

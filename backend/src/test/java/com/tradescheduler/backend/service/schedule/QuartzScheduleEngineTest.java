package com.tradescheduler.backend.service.schedule;

import com.tradescheduler.backend.config.SchedulerProperties;
import com.tradescheduler.backend.exception.NotFoundException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.impl.StdSchedulerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuartzScheduleEngineTest {

    private Scheduler scheduler;
    private ExecutorService executor;
    private QuartzScheduleEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        Properties properties = new Properties();
        properties.setProperty("org.quartz.scheduler.instanceName", "engine-test-" + UUID.randomUUID());
        properties.setProperty("org.quartz.threadPool.threadCount", "1");
        properties.setProperty("org.quartz.jobStore.class", "org.quartz.simpl.RAMJobStore");
        // Left in standby so nothing fires during the test.
        scheduler = new StdSchedulerFactory(properties).getScheduler();
        executor = Executors.newSingleThreadExecutor();
        TimeLimiter timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofSeconds(2))
                .build());
        SchedulerProperties schedulerProperties = new SchedulerProperties();
        schedulerProperties.getEngine().setNamespace("engine-test");
        engine = new QuartzScheduleEngine(scheduler, timeLimiter, executor, schedulerProperties);
    }

    @AfterEach
    void tearDown() throws Exception {
        scheduler.shutdown(false);
        executor.shutdownNow();
    }

    @Test
    void upsertThenListReturnsSameSpec() {
        TriggerSpec spec = new TriggerSpec("0 35 9 ? * MON,TUE,WED,THU,FRI", "America/New_York");

        engine.upsertTrigger("buy-tsla", spec);

        assertThat(engine.listTriggers()).containsEntry("buy-tsla", spec);
    }

    @Test
    void upsertReplacesExistingTrigger() {
        engine.upsertTrigger("buy-tsla", new TriggerSpec("0 35 9 ? * MON", "America/New_York"));
        TriggerSpec replacement = new TriggerSpec("0 0 10 ? * FRI", "Europe/London");

        engine.upsertTrigger("buy-tsla", replacement);

        assertThat(engine.listTriggers()).hasSize(1).containsEntry("buy-tsla", replacement);
    }

    @Test
    void deleteRemovesTriggerAndJob() throws Exception {
        engine.upsertTrigger("buy-tsla", new TriggerSpec("0 35 9 ? * MON", "America/New_York"));

        engine.deleteTrigger("buy-tsla");

        assertThat(engine.listTriggers()).isEmpty();
        assertThat(scheduler.checkExists(JobKey.jobKey("buy-tsla", "engine-test"))).isFalse();
    }

    @Test
    void triggersOutsideNamespaceAreIgnored() throws Exception {
        SchedulerProperties other = new SchedulerProperties();
        other.getEngine().setNamespace("someone-else");
        QuartzScheduleEngine otherEngine = new QuartzScheduleEngine(scheduler,
                TimeLimiter.of(Duration.ofSeconds(2)), executor, other);
        otherEngine.upsertTrigger("foreign", new TriggerSpec("0 0 9 ? * MON", "UTC"));

        engine.upsertTrigger("buy-tsla", new TriggerSpec("0 35 9 ? * MON", "America/New_York"));

        assertThat(engine.listTriggers()).containsOnlyKeys("buy-tsla");
    }

    @Test
    void describeReportsNextFireTime() {
        engine.upsertTrigger("buy-tsla", new TriggerSpec("0 35 9 ? * MON,TUE,WED,THU,FRI", "America/New_York"));

        List<ScheduleEngine.TriggerStatus> statuses = engine.describeTriggers();

        assertThat(statuses).singleElement().satisfies(status -> {
            assertThat(status.jobName()).isEqualTo("buy-tsla");
            assertThat(status.nextFireTime()).isNotNull();
            assertThat(status.spec().timeZone()).isEqualTo("America/New_York");
        });
    }

    @Test
    void fireNowOnUnknownJobIsNotFound() {
        assertThatThrownBy(() -> engine.fireNow("missing"))
                .isInstanceOf(NotFoundException.class);
    }
}

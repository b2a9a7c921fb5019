package com.tradescheduler.backend.service.schedule;

import com.tradescheduler.backend.model.JobDefinition;
import com.tradescheduler.backend.model.TradeAction;
import com.tradescheduler.backend.service.JobStoreService;
import com.tradescheduler.backend.service.MetricsService;
import com.tradescheduler.backend.service.SettingsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ScheduleRegistrarTest {

    private final InMemoryScheduleEngine engine = new InMemoryScheduleEngine();
    private final JobStoreService jobStoreService = mock(JobStoreService.class);
    private final SettingsService settingsService = mock(SettingsService.class);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final List<JobDefinition> store = new ArrayList<>();

    private ScheduleRegistrar registrar;

    @BeforeEach
    void setUp() {
        MetricsService metricsService = new MetricsService(meterRegistry);
        registrar = new ScheduleRegistrar(jobStoreService, settingsService, new ScheduleCompiler(), engine, metricsService);
        when(settingsService.getZone()).thenReturn(ZoneId.of("America/New_York"));
        when(jobStoreService.listEnabled()).thenAnswer(invocation ->
                store.stream().filter(JobDefinition::isEnabled).toList());
    }

    @Test
    void createsOneTriggerPerEnabledJob() {
        store.add(job("buy-tsla", List.of("mon-fri"), 9, 35, true));
        store.add(job("sell-aapl", List.of("fri"), 15, 45, false));

        ScheduleRegistrar.ReconcileReport report = registrar.reconcile();

        assertThat(report.created()).containsExactly("buy-tsla");
        assertThat(engine.triggers).containsOnlyKeys("buy-tsla");
        assertThat(engine.triggers.get("buy-tsla").cronExpression()).isEqualTo("0 35 9 ? * MON,TUE,WED,THU,FRI");
    }

    @Test
    void secondPassMakesNoEngineWrites() {
        store.add(job("buy-tsla", List.of("mon-fri"), 9, 35, true));
        store.add(job("buy-msft", List.of("weekdays"), 10, 0, true));
        registrar.reconcile();
        int writesAfterFirstPass = engine.mutatingCalls();

        ScheduleRegistrar.ReconcileReport second = registrar.reconcile();

        assertThat(engine.mutatingCalls()).isEqualTo(writesAfterFirstPass);
        assertThat(second.hasChanges()).isFalse();
        assertThat(second.unchanged()).isEqualTo(2);
        assertThat(engine.listCalls).isEqualTo(2);
    }

    @Test
    void changedScheduleReplacesTrigger() {
        store.add(job("buy-tsla", List.of("mon-fri"), 9, 35, true));
        registrar.reconcile();
        store.set(0, job("buy-tsla", List.of("mon"), 10, 0, true));

        ScheduleRegistrar.ReconcileReport report = registrar.reconcile();

        assertThat(report.updated()).containsExactly("buy-tsla");
        assertThat(engine.triggers.get("buy-tsla").cronExpression()).isEqualTo("0 0 10 ? * MON");
    }

    @Test
    void disabledAndDeletedJobsLoseTheirTriggers() {
        store.add(job("buy-tsla", List.of("mon-fri"), 9, 35, true));
        store.add(job("buy-msft", List.of("mon"), 10, 0, true));
        registrar.reconcile();

        store.set(0, job("buy-tsla", List.of("mon-fri"), 9, 35, false));
        store.remove(1);
        ScheduleRegistrar.ReconcileReport report = registrar.reconcile();

        assertThat(report.deleted()).containsExactlyInAnyOrder("buy-tsla", "buy-msft");
        assertThat(engine.triggers).isEmpty();
    }

    @Test
    void staleTriggersFromEarlierRunsAreRemoved() {
        engine.triggers.put("orphan", new TriggerSpec("0 0 9 ? * MON", "America/New_York"));

        ScheduleRegistrar.ReconcileReport report = registrar.reconcile();

        assertThat(report.deleted()).containsExactly("orphan");
        assertThat(engine.triggers).isEmpty();
    }

    @Test
    void outOfBandDeletionIsHealedByNextPass() {
        store.add(job("buy-tsla", List.of("mon-fri"), 9, 35, true));
        registrar.reconcile();
        engine.triggers.remove("buy-tsla");

        ScheduleRegistrar.ReconcileReport report = registrar.reconcile();

        assertThat(report.created()).containsExactly("buy-tsla");
        assertThat(engine.triggers).containsKey("buy-tsla");
    }

    @Test
    void timezoneChangeReplacesEveryTrigger() {
        store.add(job("buy-tsla", List.of("mon-fri"), 9, 35, true));
        store.add(job("buy-msft", List.of("mon"), 10, 0, true));
        registrar.reconcile();

        when(settingsService.getZone()).thenReturn(ZoneId.of("Europe/London"));
        ScheduleRegistrar.ReconcileReport report = registrar.reconcile();

        assertThat(report.updated()).containsExactlyInAnyOrder("buy-tsla", "buy-msft");
        assertThat(engine.triggers.values()).allSatisfy(spec -> assertThat(spec.timeZone()).isEqualTo("Europe/London"));
    }

    @Test
    void engineTimeoutIsReportedAndOtherJobsStillReconcile() {
        store.add(job("buy-tsla", List.of("mon-fri"), 9, 35, true));
        store.add(job("buy-msft", List.of("mon"), 10, 0, true));
        engine.timingOut.add("buy-tsla");

        ScheduleRegistrar.ReconcileReport report = registrar.reconcile();

        assertThat(report.succeeded()).isFalse();
        assertThat(report.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.jobName()).isEqualTo("buy-tsla");
            assertThat(failure.operation()).isEqualTo("upsert");
            assertThat(failure.timeout()).isTrue();
        });
        assertThat(report.created()).containsExactly("buy-msft");
        assertThat(meterRegistry.counter("reconcile_failures_total").count()).isEqualTo(1.0);

        engine.timingOut.clear();
        assertThat(registrar.reconcile().created()).containsExactly("buy-tsla");
    }

    @Test
    void explicitJobListIgnoresDisabledEntries() {
        ScheduleRegistrar.ReconcileReport report = registrar.reconcile(List.of(
                job("buy-tsla", List.of("mon-fri"), 9, 35, true),
                job("sell-tsla", List.of("fri"), 15, 0, false)));

        assertThat(report.created()).containsExactly("buy-tsla");
        assertThat(engine.triggers).containsOnlyKeys("buy-tsla");
    }

    @Test
    void createCountersArePublished() {
        store.add(job("buy-tsla", List.of("mon-fri"), 9, 35, true));

        registrar.reconcile();

        assertThat(meterRegistry.counter("reconcile_operations_total", "operation", "create").count()).isEqualTo(1.0);
    }

    private JobDefinition job(String name, List<String> days, int hour, int minute, boolean enabled) {
        return JobDefinition.builder()
                .name(name)
                .action(TradeAction.BUY)
                .ticker("TSLA")
                .quantity(10)
                .days(new ArrayList<>(days))
                .hour(hour)
                .minute(minute)
                .enabled(enabled)
                .build();
    }
}

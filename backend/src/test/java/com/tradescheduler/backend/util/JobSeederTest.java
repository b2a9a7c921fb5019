package com.tradescheduler.backend.util;

import com.tradescheduler.backend.model.JobDefinition;
import com.tradescheduler.backend.model.TradeAction;
import com.tradescheduler.backend.service.JobStoreService;
import com.tradescheduler.backend.service.schedule.ScheduleEngine;
import com.tradescheduler.backend.service.schedule.ScheduleRegistrar;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:seeded;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
        "spring.quartz.scheduler-name=seed-scheduler",
        "scheduler.seed.file=classpath:seed-jobs.json"
})
class JobSeederTest {

    @Autowired
    private JobStoreService jobStoreService;

    @Autowired
    private ScheduleRegistrar scheduleRegistrar;

    @Autowired
    private ScheduleEngine scheduleEngine;

    @Test
    void validSeedJobsAreImportedAndInvalidOnesSkipped() {
        assertThat(jobStoreService.list()).extracting(JobDefinition::getName)
                .containsExactly("buy-tsla", "sell-aapl-friday");

        JobDefinition sell = jobStoreService.get("sell-aapl-friday");
        assertThat(sell.getAction()).isEqualTo(TradeAction.SELL);
        assertThat(sell.getTicker()).isEqualTo("AAPL");
        assertThat(sell.isEnabled()).isFalse();
    }

    @Test
    void onlyEnabledSeedJobsGetTriggers() {
        scheduleRegistrar.reconcile();

        assertThat(scheduleEngine.listTriggers()).containsOnlyKeys("buy-tsla");
    }
}

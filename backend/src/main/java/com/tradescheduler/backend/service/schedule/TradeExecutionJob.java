package com.tradescheduler.backend.service.schedule;

import com.tradescheduler.backend.config.RequestCorrelationFilter;
import com.tradescheduler.backend.service.TradeExecutionHandler;
import lombok.extern.slf4j.Slf4j;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.JobExecutionContext;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.quartz.QuartzJobBean;

import java.time.Instant;
import java.util.Date;

/**
 * Quartz entry point for a trigger fire. Fires of the same job never overlap;
 * different jobs run in parallel on the Quartz thread pool.
 */
@Slf4j
@DisallowConcurrentExecution
public class TradeExecutionJob extends QuartzJobBean {

    public static final String JOB_NAME_KEY = "jobName";

    private TradeExecutionHandler tradeExecutionHandler;
    private String jobName;

    @Autowired
    public void setTradeExecutionHandler(TradeExecutionHandler tradeExecutionHandler) {
        this.tradeExecutionHandler = tradeExecutionHandler;
    }

    // Bound from the job data map by QuartzJobBean.
    public void setJobName(String jobName) {
        this.jobName = jobName;
    }

    @Override
    protected void executeInternal(JobExecutionContext context) {
        Date scheduled = context.getScheduledFireTime();
        Instant fireTime = scheduled != null ? scheduled.toInstant() : Instant.now();
        // The client order id doubles as the correlation id of a fire.
        MDC.put(RequestCorrelationFilter.MDC_JOB_NAME, jobName);
        MDC.put(RequestCorrelationFilter.MDC_CORRELATION_ID, TradeExecutionHandler.clientOrderId(jobName, fireTime));
        try {
            log.debug("Trigger fired job={} scheduledFireTime={}", jobName, fireTime);
            tradeExecutionHandler.execute(jobName, fireTime);
        } finally {
            MDC.remove(RequestCorrelationFilter.MDC_JOB_NAME);
            MDC.remove(RequestCorrelationFilter.MDC_CORRELATION_ID);
        }
    }
}

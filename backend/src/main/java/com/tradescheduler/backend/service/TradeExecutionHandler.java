package com.tradescheduler.backend.service;

import com.tradescheduler.backend.exception.TradingApiCircuitOpenException;
import com.tradescheduler.backend.exception.TradingApiException;
import com.tradescheduler.backend.exception.TradingApiRateLimitException;
import com.tradescheduler.backend.exception.TradingApiServerException;
import com.tradescheduler.backend.exception.TradingApiTimeoutException;
import com.tradescheduler.backend.exception.TradingApiUnavailableException;
import com.tradescheduler.backend.model.ExecutionOutcome;
import com.tradescheduler.backend.model.ExecutionRecord;
import com.tradescheduler.backend.model.FailureKind;
import com.tradescheduler.backend.model.JobDefinition;
import com.tradescheduler.backend.service.trading.TradingApiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Runs one trigger fire: re-reads the job, submits one order and writes one
 * execution record. Never throws, and never retries on its own; a failed fire
 * waits for the next scheduled one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeExecutionHandler {

    static final int MAX_REASON_LENGTH = 512;

    private final JobStoreService jobStoreService;
    private final TradingApiClient tradingApiClient;
    private final ExecutionRecordService executionRecordService;
    private final MetricsService metricsService;

    public ExecutionRecord execute(String jobName, Instant fireTime) {
        ExecutionRecord.ExecutionRecordBuilder record = ExecutionRecord.builder()
                .jobName(jobName)
                .fireTime(fireTime)
                .startedAt(Instant.now());
        try {
            record.tradingMode(tradingApiClient.mode());
            Optional<JobDefinition> current = jobStoreService.find(jobName);
            if (current.isEmpty()) {
                log.info("Skipping fire job={} fireTime={}: job no longer exists", jobName, fireTime);
                record.outcome(ExecutionOutcome.SKIPPED).reason("job not found");
            } else if (!current.get().isEnabled()) {
                log.info("Skipping fire job={} fireTime={}: job disabled", jobName, fireTime);
                record.outcome(ExecutionOutcome.SKIPPED).reason("job disabled");
            } else {
                submit(current.get(), fireTime, record);
            }
        } catch (TradingApiException e) {
            FailureKind kind = classify(e);
            log.warn("Order failed job={} fireTime={} kind={} message={}", jobName, fireTime, kind.label(), e.getMessage());
            record.outcome(ExecutionOutcome.FAILED)
                    .failureKind(kind)
                    .reason(kind == FailureKind.TIMEOUT ? kind.label() : truncate(kind.label() + ": " + e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected failure executing job={} fireTime={}", jobName, fireTime, e);
            record.outcome(ExecutionOutcome.FAILED)
                    .failureKind(FailureKind.ERROR)
                    .reason(truncate("error: " + e.getMessage()));
        }
        ExecutionRecord result = record.finishedAt(Instant.now()).build();
        metricsService.recordExecution(result.getOutcome());
        try {
            return executionRecordService.record(result);
        } catch (RuntimeException e) {
            log.error("Failed to persist execution record job={} fireTime={} outcome={} reason={}",
                    jobName, fireTime, result.getOutcome(), result.getReason(), e);
            return result;
        }
    }

    /**
     * Broker-side idempotency key for one fire of one job.
     */
    public static String clientOrderId(String jobName, Instant fireTime) {
        return jobName + "-" + fireTime.getEpochSecond();
    }

    private void submit(JobDefinition job, Instant fireTime, ExecutionRecord.ExecutionRecordBuilder record) {
        String clientOrderId = clientOrderId(job.getName(), fireTime);
        record.action(job.getAction())
                .ticker(job.getTicker())
                .quantity(job.getQuantity())
                .clientOrderId(clientOrderId);
        TradingApiClient.OrderResult result = tradingApiClient.submitOrder(new TradingApiClient.OrderRequest(
                job.getAction(), job.getTicker(), job.getQuantity(), clientOrderId));
        record.outcome(ExecutionOutcome.SUCCESS)
                .brokerOrderId(result.orderId())
                .reason(result.status() == null ? null : "order " + result.status());
    }

    private FailureKind classify(TradingApiException e) {
        if (e instanceof TradingApiTimeoutException) {
            return FailureKind.TIMEOUT;
        }
        if (e instanceof TradingApiRateLimitException) {
            return FailureKind.RATE_LIMITED;
        }
        if (e instanceof TradingApiServerException
                || e instanceof TradingApiCircuitOpenException
                || e instanceof TradingApiUnavailableException) {
            return FailureKind.UNAVAILABLE;
        }
        if (e.getStatusCode() >= 400 && e.getStatusCode() < 500) {
            return FailureKind.REJECTED;
        }
        return FailureKind.ERROR;
    }

    private String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH);
    }
}

package com.tradescheduler.backend.service;

import com.tradescheduler.backend.model.ExecutionOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    @PostConstruct
    void init() {
        Counter.builder("reconcile_failures_total").register(meterRegistry);
    }

    public void recordExecution(ExecutionOutcome outcome) {
        meterRegistry.counter("trade_executions_total", "outcome", outcome.name().toLowerCase(Locale.ROOT))
                .increment();
    }

    public void recordReconcileOperation(String operation, int count) {
        if (count <= 0) {
            return;
        }
        meterRegistry.counter("reconcile_operations_total", "operation", operation).increment(count);
    }

    public void incrementReconcileFailures() {
        meterRegistry.counter("reconcile_failures_total").increment();
    }

    public void recordTaskFailure(String taskName) {
        meterRegistry.counter("scheduled_task_failures_total", "task", taskName).increment();
    }
}

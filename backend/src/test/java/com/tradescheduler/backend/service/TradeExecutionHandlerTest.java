package com.tradescheduler.backend.service;

import com.tradescheduler.backend.exception.TradingApiCircuitOpenException;
import com.tradescheduler.backend.exception.TradingApiException;
import com.tradescheduler.backend.exception.TradingApiRateLimitException;
import com.tradescheduler.backend.exception.TradingApiTimeoutException;
import com.tradescheduler.backend.model.ExecutionOutcome;
import com.tradescheduler.backend.model.ExecutionRecord;
import com.tradescheduler.backend.model.FailureKind;
import com.tradescheduler.backend.model.JobDefinition;
import com.tradescheduler.backend.model.TradeAction;
import com.tradescheduler.backend.model.TradingMode;
import com.tradescheduler.backend.service.trading.TradingApiClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TradeExecutionHandlerTest {

    private static final Instant FIRE_TIME = Instant.parse("2024-03-04T14:35:00Z");

    private final JobStoreService jobStoreService = mock(JobStoreService.class);
    private final TradingApiClient tradingApiClient = mock(TradingApiClient.class);
    private final ExecutionRecordService executionRecordService = mock(ExecutionRecordService.class);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private TradeExecutionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new TradeExecutionHandler(jobStoreService, tradingApiClient, executionRecordService,
                new MetricsService(meterRegistry));
        when(tradingApiClient.mode()).thenReturn(TradingMode.PAPER);
        when(executionRecordService.record(any())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void submitsCurrentDefinitionAtFireTime() {
        when(jobStoreService.find("buy-tsla")).thenReturn(Optional.of(job(10, true)));
        when(tradingApiClient.submitOrder(any())).thenReturn(
                new TradingApiClient.OrderResult("ord-1", "buy-tsla-1709562900", "accepted"));

        ExecutionRecord record = handler.execute("buy-tsla", FIRE_TIME);

        ArgumentCaptor<TradingApiClient.OrderRequest> captor = ArgumentCaptor.forClass(TradingApiClient.OrderRequest.class);
        verify(tradingApiClient).submitOrder(captor.capture());
        assertThat(captor.getValue()).isEqualTo(new TradingApiClient.OrderRequest(
                TradeAction.BUY, "TSLA", 10, "buy-tsla-" + FIRE_TIME.getEpochSecond()));
        assertThat(record.getOutcome()).isEqualTo(ExecutionOutcome.SUCCESS);
        assertThat(record.getBrokerOrderId()).isEqualTo("ord-1");
        assertThat(record.getTradingMode()).isEqualTo(TradingMode.PAPER);
        assertThat(meterRegistry.counter("trade_executions_total", "outcome", "success").count()).isEqualTo(1.0);
    }

    @Test
    void quantityChangeIsPickedUpOnNextFire() {
        when(jobStoreService.find("buy-tsla"))
                .thenReturn(Optional.of(job(10, true)))
                .thenReturn(Optional.of(job(20, true)));
        when(tradingApiClient.submitOrder(any())).thenReturn(new TradingApiClient.OrderResult("ord", null, "new"));

        handler.execute("buy-tsla", FIRE_TIME);
        handler.execute("buy-tsla", FIRE_TIME.plusSeconds(86400));

        ArgumentCaptor<TradingApiClient.OrderRequest> captor = ArgumentCaptor.forClass(TradingApiClient.OrderRequest.class);
        verify(tradingApiClient, times(2)).submitOrder(captor.capture());
        assertThat(captor.getAllValues()).extracting(TradingApiClient.OrderRequest::quantity).containsExactly(10, 20);
    }

    @Test
    void missingJobIsSkipped() {
        when(jobStoreService.find("gone")).thenReturn(Optional.empty());

        ExecutionRecord record = handler.execute("gone", FIRE_TIME);

        assertThat(record.getOutcome()).isEqualTo(ExecutionOutcome.SKIPPED);
        assertThat(record.getReason()).isEqualTo("job not found");
        verify(tradingApiClient, never()).submitOrder(any());
        verify(executionRecordService).record(any());
    }

    @Test
    void disabledJobIsSkipped() {
        when(jobStoreService.find("buy-tsla")).thenReturn(Optional.of(job(10, false)));

        ExecutionRecord record = handler.execute("buy-tsla", FIRE_TIME);

        assertThat(record.getOutcome()).isEqualTo(ExecutionOutcome.SKIPPED);
        assertThat(record.getReason()).isEqualTo("job disabled");
        verify(tradingApiClient, never()).submitOrder(any());
    }

    @Test
    void timeoutIsRecordedOnceWithoutRetry() {
        when(jobStoreService.find("buy-tsla")).thenReturn(Optional.of(job(10, true)));
        when(tradingApiClient.submitOrder(any())).thenThrow(new TradingApiTimeoutException("read timed out", null));

        ExecutionRecord record = handler.execute("buy-tsla", FIRE_TIME);

        assertThat(record.getOutcome()).isEqualTo(ExecutionOutcome.FAILED);
        assertThat(record.getFailureKind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(record.getReason()).isEqualTo("timeout");
        verify(tradingApiClient, times(1)).submitOrder(any());
        verify(executionRecordService, times(1)).record(any());
    }

    @Test
    void failuresAreClassified() {
        when(jobStoreService.find("buy-tsla")).thenReturn(Optional.of(job(10, true)));
        when(tradingApiClient.submitOrder(any()))
                .thenThrow(new TradingApiException("insufficient buying power", 403, null))
                .thenThrow(new TradingApiRateLimitException("slow down"))
                .thenThrow(new TradingApiCircuitOpenException("open", null))
                .thenThrow(new IllegalStateException("boom"));

        List<FailureKind> kinds = List.of(
                handler.execute("buy-tsla", FIRE_TIME).getFailureKind(),
                handler.execute("buy-tsla", FIRE_TIME).getFailureKind(),
                handler.execute("buy-tsla", FIRE_TIME).getFailureKind(),
                handler.execute("buy-tsla", FIRE_TIME).getFailureKind());

        assertThat(kinds).containsExactly(FailureKind.REJECTED, FailureKind.RATE_LIMITED,
                FailureKind.UNAVAILABLE, FailureKind.ERROR);
    }

    @Test
    void recordPersistenceFailureDoesNotPropagate() {
        when(jobStoreService.find("buy-tsla")).thenReturn(Optional.empty());
        when(executionRecordService.record(any())).thenThrow(new IllegalStateException("db down"));

        ExecutionRecord record = handler.execute("buy-tsla", FIRE_TIME);

        assertThat(record.getOutcome()).isEqualTo(ExecutionOutcome.SKIPPED);
    }

    private JobDefinition job(int quantity, boolean enabled) {
        return JobDefinition.builder()
                .name("buy-tsla")
                .action(TradeAction.BUY)
                .ticker("TSLA")
                .quantity(quantity)
                .days(new ArrayList<>(List.of("mon-fri")))
                .hour(9)
                .minute(35)
                .enabled(enabled)
                .build();
    }
}

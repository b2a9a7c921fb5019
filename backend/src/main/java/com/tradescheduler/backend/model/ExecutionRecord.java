package com.tradescheduler.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row per trigger fire. Rows are inserted once and never updated.
 */
@Entity
@Table(name = "execution_records")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_name", nullable = false, length = 100)
    private String jobName;

    @Column(name = "fire_time", nullable = false)
    private Instant fireTime;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at", nullable = false)
    private Instant finishedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ExecutionOutcome outcome;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind", length = 16)
    private FailureKind failureKind;

    @Column(length = 512)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private TradeAction action;

    @Column(length = 16)
    private String ticker;

    @Column
    private Integer quantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "trading_mode", length = 8)
    private TradingMode tradingMode;

    @Column(name = "broker_order_id", length = 64)
    private String brokerOrderId;

    @Column(name = "client_order_id", length = 128)
    private String clientOrderId;
}

package com.tradescheduler.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionRecordResponse {
    private Long id;
    private String jobName;
    private Instant fireTime;
    private Instant startedAt;
    private Instant finishedAt;
    private String outcome;
    private String failureKind;
    private String reason;
    private String summary;
    private String action;
    private String ticker;
    private Integer quantity;
    private String tradingMode;
    private String brokerOrderId;
    private String clientOrderId;
}

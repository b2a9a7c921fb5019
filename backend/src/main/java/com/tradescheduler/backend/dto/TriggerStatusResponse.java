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
public class TriggerStatusResponse {
    private String jobName;
    private String cronExpression;
    private String timezone;
    private String state;
    private Instant nextFireTime;
    private Instant previousFireTime;
}

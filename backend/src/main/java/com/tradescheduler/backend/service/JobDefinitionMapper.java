package com.tradescheduler.backend.service;

import com.tradescheduler.backend.dto.ExecutionRecordResponse;
import com.tradescheduler.backend.dto.JobDefinitionDTO;
import com.tradescheduler.backend.dto.ScheduleDTO;
import com.tradescheduler.backend.exception.ValidationException;
import com.tradescheduler.backend.model.ExecutionRecord;
import com.tradescheduler.backend.model.JobDefinition;
import com.tradescheduler.backend.model.TradeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class JobDefinitionMapper {

    public JobDefinition toDefinition(JobDefinitionDTO dto) {
        if (dto == null) {
            throw new ValidationException("Job definition is required");
        }
        // An unknown action maps to null and is reported by the validator.
        TradeAction action = TradeAction.parse(dto.getAction()).orElse(null);
        ScheduleDTO schedule = dto.getSchedule();
        return JobDefinition.builder()
                .name(dto.getName())
                .action(action)
                .ticker(dto.getTicker())
                .quantity(dto.getQuantity())
                .days(schedule == null || schedule.getDays() == null
                        ? new ArrayList<>() : new ArrayList<>(schedule.getDays()))
                .hour(schedule == null ? null : schedule.getHour())
                .minute(schedule == null ? null : schedule.getMinute())
                .enabled(dto.getEnabled() == null || dto.getEnabled())
                .build();
    }

    public JobDefinitionDTO toDto(JobDefinition job) {
        return JobDefinitionDTO.builder()
                .name(job.getName())
                .action(job.getAction().wireValue())
                .ticker(job.getTicker())
                .quantity(job.getQuantity())
                .schedule(ScheduleDTO.builder()
                        .days(List.copyOf(job.getDays()))
                        .hour(job.getHour())
                        .minute(job.getMinute())
                        .build())
                .enabled(job.isEnabled())
                .version(job.getVersion())
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .build();
    }

    public ExecutionRecordResponse toResponse(ExecutionRecord record) {
        return ExecutionRecordResponse.builder()
                .id(record.getId())
                .jobName(record.getJobName())
                .fireTime(record.getFireTime())
                .startedAt(record.getStartedAt())
                .finishedAt(record.getFinishedAt())
                .outcome(record.getOutcome().name())
                .failureKind(record.getFailureKind() == null ? null : record.getFailureKind().name())
                .reason(record.getReason())
                .summary(summary(record))
                .action(record.getAction() == null ? null : record.getAction().wireValue())
                .ticker(record.getTicker())
                .quantity(record.getQuantity())
                .tradingMode(record.getTradingMode() == null ? null : record.getTradingMode().name())
                .brokerOrderId(record.getBrokerOrderId())
                .clientOrderId(record.getClientOrderId())
                .build();
    }

    /**
     * e.g. {@code failed: timeout}, {@code skipped: job disabled}.
     */
    private String summary(ExecutionRecord record) {
        String outcome = record.getOutcome().name().toLowerCase(Locale.ROOT);
        return record.getReason() == null ? outcome : outcome + ": " + record.getReason();
    }
}

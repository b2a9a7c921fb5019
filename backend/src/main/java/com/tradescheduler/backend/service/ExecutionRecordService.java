package com.tradescheduler.backend.service;

import com.tradescheduler.backend.config.SchedulerProperties;
import com.tradescheduler.backend.model.ExecutionRecord;
import com.tradescheduler.backend.repository.ExecutionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionRecordService {

    private final ExecutionRecordRepository executionRecordRepository;
    private final SchedulerProperties schedulerProperties;

    @Transactional
    public ExecutionRecord record(ExecutionRecord executionRecord) {
        ExecutionRecord saved = executionRecordRepository.save(executionRecord);
        log.info("Execution recorded job={} fireTime={} outcome={} reason={}",
                saved.getJobName(), saved.getFireTime(), saved.getOutcome(), saved.getReason());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ExecutionRecord> listForJob(String jobName, Integer limit) {
        return executionRecordRepository.findByJobNameOrderByFireTimeDescIdDesc(jobName,
                PageRequest.of(0, clampLimit(limit)));
    }

    @Transactional(readOnly = true)
    public List<ExecutionRecord> listRecent(Integer limit) {
        return executionRecordRepository.findAllByOrderByFireTimeDescIdDesc(PageRequest.of(0, clampLimit(limit)));
    }

    int clampLimit(Integer limit) {
        SchedulerProperties.HistoryProperties history = schedulerProperties.getHistory();
        if (limit == null || limit <= 0) {
            return history.getDefaultLimit();
        }
        return Math.min(limit, history.getMaxLimit());
    }
}

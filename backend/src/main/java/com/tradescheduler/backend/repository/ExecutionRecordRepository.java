package com.tradescheduler.backend.repository;

import com.tradescheduler.backend.model.ExecutionRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ExecutionRecordRepository extends JpaRepository<ExecutionRecord, Long> {

    List<ExecutionRecord> findByJobNameOrderByFireTimeDescIdDesc(String jobName, Pageable pageable);

    List<ExecutionRecord> findAllByOrderByFireTimeDescIdDesc(Pageable pageable);

    long countByJobName(String jobName);
}

package com.tradescheduler.backend.repository;

import com.tradescheduler.backend.model.JobDefinition;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface JobDefinitionRepository extends JpaRepository<JobDefinition, Long> {

    Optional<JobDefinition> findByName(String name);

    boolean existsByName(String name);

    List<JobDefinition> findAllByOrderByNameAsc();

    List<JobDefinition> findByEnabledTrueOrderByNameAsc();
}

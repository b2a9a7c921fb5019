package com.tradescheduler.backend.service;

import com.tradescheduler.backend.exception.ConflictException;
import com.tradescheduler.backend.exception.NotFoundException;
import com.tradescheduler.backend.exception.ValidationException;
import com.tradescheduler.backend.model.JobDefinition;
import com.tradescheduler.backend.repository.JobDefinitionRepository;
import com.tradescheduler.backend.util.KeyedLockRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Durable home of job definitions. Writes to one name are serialized; the
 * lock is held until the transaction has committed, so a reader that follows
 * a returned write always sees it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStoreService {

    private final JobDefinitionRepository jobDefinitionRepository;
    private final JobDefinitionValidator jobDefinitionValidator;
    private final KeyedLockRegistry keyedLockRegistry;
    private final TransactionTemplate transactionTemplate;

    public Optional<JobDefinition> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return jobDefinitionRepository.findByName(name.trim());
    }

    public JobDefinition get(String name) {
        return find(name).orElseThrow(() -> new NotFoundException("Job '" + name + "' not found"));
    }

    public List<JobDefinition> list() {
        return jobDefinitionRepository.findAllByOrderByNameAsc();
    }

    public List<JobDefinition> listEnabled() {
        return jobDefinitionRepository.findByEnabledTrueOrderByNameAsc();
    }

    public boolean isEmpty() {
        return jobDefinitionRepository.count() == 0;
    }

    /**
     * Inserts the definition, or replaces the stored one with the same name.
     */
    public JobDefinition put(JobDefinition candidate) {
        JobDefinition job = jobDefinitionValidator.validate(candidate);
        return keyedLockRegistry.withLock(job.getName(), () -> write(() -> {
            JobDefinition saved = jobDefinitionRepository.findByName(job.getName())
                    .map(existing -> jobDefinitionRepository.saveAndFlush(apply(existing, job)))
                    .orElseGet(() -> jobDefinitionRepository.saveAndFlush(fresh(job)));
            log.info("Stored job name={} version={}", saved.getName(), saved.getVersion());
            return saved;
        }, job.getName()));
    }

    public JobDefinition create(JobDefinition candidate) {
        JobDefinition job = jobDefinitionValidator.validate(candidate);
        return keyedLockRegistry.withLock(job.getName(), () -> write(() -> {
            if (jobDefinitionRepository.existsByName(job.getName())) {
                throw new ConflictException("Job '" + job.getName() + "' already exists");
            }
            JobDefinition saved = jobDefinitionRepository.saveAndFlush(fresh(job));
            log.info("Created job name={} action={} ticker={} quantity={}",
                    saved.getName(), saved.getAction(), saved.getTicker(), saved.getQuantity());
            return saved;
        }, job.getName()));
    }

    /**
     * Replaces the stored definition named {@code name}. The candidate's own
     * name, if any, must match.
     */
    public JobDefinition update(String name, JobDefinition candidate) {
        if (candidate != null && candidate.getName() != null && !candidate.getName().isBlank()
                && !candidate.getName().trim().equals(name)) {
            throw new ValidationException(
                    "Job name in body '" + candidate.getName() + "' does not match path '" + name + "'");
        }
        JobDefinition job = jobDefinitionValidator.validate(
                candidate == null ? null : candidate.toBuilder().name(name).build());
        return keyedLockRegistry.withLock(job.getName(), () -> write(() -> {
            JobDefinition existing = jobDefinitionRepository.findByName(job.getName())
                    .orElseThrow(() -> new NotFoundException("Job '" + job.getName() + "' not found"));
            JobDefinition saved = jobDefinitionRepository.saveAndFlush(apply(existing, job));
            log.info("Updated job name={} version={}", saved.getName(), saved.getVersion());
            return saved;
        }, job.getName()));
    }

    public void delete(String name) {
        String key = name == null ? "" : name.trim();
        keyedLockRegistry.withLock(key, () -> write(() -> {
            JobDefinition existing = jobDefinitionRepository.findByName(key)
                    .orElseThrow(() -> new NotFoundException("Job '" + key + "' not found"));
            jobDefinitionRepository.delete(existing);
            log.info("Deleted job name={}", key);
            return null;
        }, key));
    }

    private <T> T write(Supplier<T> work, String name) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataIntegrityViolationException ex) {
            throw new ConflictException("Job '" + name + "' was written concurrently", ex);
        }
    }

    private JobDefinition fresh(JobDefinition job) {
        return job.toBuilder()
                .id(null)
                .version(null)
                .createdAt(null)
                .updatedAt(null)
                .build();
    }

    private JobDefinition apply(JobDefinition existing, JobDefinition job) {
        existing.setAction(job.getAction());
        existing.setTicker(job.getTicker());
        existing.setQuantity(job.getQuantity());
        existing.setDays(new ArrayList<>(job.getDays()));
        existing.setHour(job.getHour());
        existing.setMinute(job.getMinute());
        existing.setEnabled(job.isEnabled());
        return existing;
    }
}

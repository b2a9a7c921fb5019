package com.tradescheduler.backend.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradescheduler.backend.config.SchedulerProperties;
import com.tradescheduler.backend.dto.JobDefinitionDTO;
import com.tradescheduler.backend.exception.ConflictException;
import com.tradescheduler.backend.exception.ValidationException;
import com.tradescheduler.backend.service.JobDefinitionMapper;
import com.tradescheduler.backend.service.JobStoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Imports the jobs listed in {@code scheduler.seed.file} when the store is
 * empty. Accepts {@code classpath:} and {@code file:} locations. Runs before
 * the startup reconcile, which registers the imported jobs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobSeeder implements ApplicationRunner {

    private final SchedulerProperties schedulerProperties;
    private final JobStoreService jobStoreService;
    private final JobDefinitionMapper jobDefinitionMapper;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) {
        String location = schedulerProperties.getSeed().getFile();
        if (location == null || location.isBlank()) {
            return;
        }
        if (!jobStoreService.isEmpty()) {
            log.info("Job store not empty, skipping seed file {}", location);
            return;
        }
        List<JobDefinitionDTO> jobs = read(location);
        int imported = 0;
        for (JobDefinitionDTO dto : jobs) {
            try {
                jobStoreService.create(jobDefinitionMapper.toDefinition(dto));
                imported++;
            } catch (ValidationException | ConflictException ex) {
                log.warn("Seed job '{}' skipped: {} {}", dto.getName(), ex.getMessage(),
                        ex instanceof ValidationException validation ? validation.getViolations() : "");
            }
        }
        log.info("Seeded {} of {} job(s) from {}", imported, jobs.size(), location);
    }

    private List<JobDefinitionDTO> read(String location) {
        Resource resource = new DefaultResourceLoader().getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<JobDefinitionDTO>>() {
            });
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot read seed file " + location, ex);
        }
    }
}

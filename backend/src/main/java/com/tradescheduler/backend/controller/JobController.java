package com.tradescheduler.backend.controller;

import com.tradescheduler.backend.dto.ExecutionRecordResponse;
import com.tradescheduler.backend.dto.JobDefinitionDTO;
import com.tradescheduler.backend.model.JobDefinition;
import com.tradescheduler.backend.service.JobDefinitionMapper;
import com.tradescheduler.backend.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
@Tag(name = "Jobs")
public class JobController {

    private final JobManagementService jobManagementService;
    private final JobDefinitionMapper jobDefinitionMapper;

    @GetMapping
    @Operation(summary = "List all jobs ordered by name")
    public ResponseEntity<List<JobDefinitionDTO>> list() {
        return ResponseEntity.ok(jobManagementService.list().stream()
                .map(jobDefinitionMapper::toDto)
                .toList());
    }

    @GetMapping("/{name}")
    @Operation(summary = "Get one job")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = JobDefinitionDTO.class)))
    @ApiResponse(responseCode = "404", content = @Content)
    public ResponseEntity<JobDefinitionDTO> get(@PathVariable String name) {
        return ResponseEntity.ok(jobDefinitionMapper.toDto(jobManagementService.get(name)));
    }

    @PostMapping
    @Operation(summary = "Create a job and register its trigger")
    @ApiResponse(responseCode = "201", content = @Content(schema = @Schema(implementation = JobDefinitionDTO.class)))
    @ApiResponse(responseCode = "409", content = @Content)
    public ResponseEntity<JobDefinitionDTO> create(@RequestBody JobDefinitionDTO request) {
        JobDefinition created = jobManagementService.create(jobDefinitionMapper.toDefinition(request));
        URI location = ServletUriComponentsBuilder.fromCurrentRequest()
                .path("/{name}")
                .buildAndExpand(created.getName())
                .toUri();
        return ResponseEntity.created(location).body(jobDefinitionMapper.toDto(created));
    }

    @PutMapping("/{name}")
    @Operation(summary = "Replace a job; its trigger follows the new definition")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = JobDefinitionDTO.class)))
    @ApiResponse(responseCode = "404", content = @Content)
    public ResponseEntity<JobDefinitionDTO> update(@PathVariable String name,
                                                   @RequestBody JobDefinitionDTO request) {
        JobDefinition updated = jobManagementService.update(name, jobDefinitionMapper.toDefinition(request));
        return ResponseEntity.ok(jobDefinitionMapper.toDto(updated));
    }

    @DeleteMapping("/{name}")
    @Operation(summary = "Delete a job and its trigger")
    @ApiResponse(responseCode = "204", content = @Content)
    public ResponseEntity<Void> delete(@PathVariable String name) {
        jobManagementService.delete(name);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{name}/run")
    @Operation(summary = "Fire a job once now, outside its schedule")
    @ApiResponse(responseCode = "202", content = @Content)
    public ResponseEntity<Map<String, String>> run(@PathVariable String name) {
        jobManagementService.runNow(name);
        log.info("Manual run requested job={}", name);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("job", name, "status", "fired"));
    }

    @GetMapping("/{name}/executions")
    @Operation(summary = "Latest execution records for a job, newest first")
    public ResponseEntity<List<ExecutionRecordResponse>> executions(@PathVariable String name,
                                                                    @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(jobManagementService.executions(name, limit).stream()
                .map(jobDefinitionMapper::toResponse)
                .toList());
    }
}

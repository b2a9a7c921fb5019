package com.tradescheduler.backend.controller;

import com.tradescheduler.backend.dto.ExecutionRecordResponse;
import com.tradescheduler.backend.service.JobDefinitionMapper;
import com.tradescheduler.backend.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
@Tag(name = "Executions")
public class ExecutionController {

    private final JobManagementService jobManagementService;
    private final JobDefinitionMapper jobDefinitionMapper;

    @GetMapping
    @Operation(summary = "Latest execution records across all jobs, newest first")
    public ResponseEntity<List<ExecutionRecordResponse>> recent(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(jobManagementService.recentExecutions(limit).stream()
                .map(jobDefinitionMapper::toResponse)
                .toList());
    }
}

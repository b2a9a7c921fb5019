package com.tradescheduler.backend.controller;

import com.tradescheduler.backend.dto.TriggerStatusResponse;
import com.tradescheduler.backend.service.JobManagementService;
import com.tradescheduler.backend.service.schedule.ScheduleEngine;
import com.tradescheduler.backend.service.schedule.ScheduleRegistrar;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/schedules")
@RequiredArgsConstructor
@Tag(name = "Schedules")
public class ScheduleController {

    private final JobManagementService jobManagementService;

    @GetMapping
    @Operation(summary = "Triggers currently registered with the engine")
    public ResponseEntity<List<TriggerStatusResponse>> list() {
        return ResponseEntity.ok(jobManagementService.triggers().stream()
                .map(this::toResponse)
                .toList());
    }

    @PostMapping("/reconcile")
    @Operation(summary = "Run a reconcile pass now and return what it changed")
    public ResponseEntity<ScheduleRegistrar.ReconcileReport> reconcile() {
        return ResponseEntity.ok(jobManagementService.reconcile());
    }

    private TriggerStatusResponse toResponse(ScheduleEngine.TriggerStatus status) {
        return TriggerStatusResponse.builder()
                .jobName(status.jobName())
                .cronExpression(status.spec().cronExpression())
                .timezone(status.spec().timeZone())
                .state(status.state())
                .nextFireTime(status.nextFireTime())
                .previousFireTime(status.previousFireTime())
                .build();
    }
}

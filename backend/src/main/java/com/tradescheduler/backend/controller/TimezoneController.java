package com.tradescheduler.backend.controller;

import com.tradescheduler.backend.dto.TimezoneDTO;
import com.tradescheduler.backend.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/timezone")
@RequiredArgsConstructor
@Tag(name = "Settings")
public class TimezoneController {

    private final JobManagementService jobManagementService;

    @GetMapping
    @Operation(summary = "Timezone all triggers fire in")
    public ResponseEntity<TimezoneDTO> get() {
        return ResponseEntity.ok(new TimezoneDTO(jobManagementService.getTimezone()));
    }

    @PutMapping
    @Operation(summary = "Change the timezone and re-register every trigger in it")
    public ResponseEntity<TimezoneDTO> update(@Valid @RequestBody TimezoneDTO request) {
        return ResponseEntity.ok(new TimezoneDTO(jobManagementService.updateTimezone(request.getTimezone())));
    }
}

package com.tradescheduler.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Error body of every management API failure. {@code retryable} is set when
 * the same request may succeed later without changes, i.e. when the
 * scheduling engine was slow or unavailable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

    private Instant timestamp;
    private String path;
    private int status;
    private String error;
    private Code code;
    private String message;
    private String jobName;
    private boolean retryable;
    private String requestId;
    private String correlationId;
    private List<ApiErrorDetail> details;

    public enum Code {
        INVALID_JOB,
        INVALID_SCHEDULE,
        MALFORMED_REQUEST,
        JOB_NOT_FOUND,
        JOB_CONFLICT,
        STALE_WRITE,
        ENGINE_TIMEOUT,
        ENGINE_UNAVAILABLE,
        INTERNAL_ERROR
    }
}

package com.tradescheduler.backend.exception;

import com.tradescheduler.backend.config.RequestCorrelationFilter;
import com.tradescheduler.backend.dto.ApiError;
import com.tradescheduler.backend.dto.ApiErrorDetail;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toDetail)
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, ApiError.Code.MALFORMED_REQUEST, "Validation failed", details, request, ex);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraint(ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getConstraintViolations().stream()
                .map(violation -> ApiErrorDetail.builder()
                        .field(violation.getPropertyPath().toString())
                        .issue(violation.getMessage())
                        .build())
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, ApiError.Code.MALFORMED_REQUEST, "Validation failed", details, request, ex);
    }

    /**
     * Store-layer validation. Messages reach the caller as written by the
     * validator, one detail per violation.
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleDomainValidation(ValidationException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getViolations().stream()
                .map(issue -> ApiErrorDetail.builder().issue(issue).build())
                .collect(Collectors.toList());
        ApiError.Code code = ex instanceof InvalidScheduleException ? ApiError.Code.INVALID_SCHEDULE : ApiError.Code.INVALID_JOB;
        return buildError(HttpStatus.BAD_REQUEST, code, ex.getMessage(), details, request, ex);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, ApiError.Code.MALFORMED_REQUEST, "Malformed request", List.of(), request, ex);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        return buildError(HttpStatus.NOT_FOUND, ApiError.Code.JOB_NOT_FOUND, ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiError> handleConflict(ConflictException ex, HttpServletRequest request) {
        return buildError(HttpStatus.CONFLICT, ApiError.Code.JOB_CONFLICT, ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ApiError> handleStaleWrite(ObjectOptimisticLockingFailureException ex, HttpServletRequest request) {
        return buildError(HttpStatus.CONFLICT, ApiError.Code.STALE_WRITE,
                "Job was modified concurrently, retry the request", List.of(), request, ex);
    }

    @ExceptionHandler(ReconciliationException.class)
    public ResponseEntity<ApiError> handleReconciliation(ReconciliationException ex, HttpServletRequest request) {
        if (ex.isTimeout()) {
            return buildError(HttpStatus.GATEWAY_TIMEOUT, ApiError.Code.ENGINE_TIMEOUT, ex.getMessage(), List.of(), request, ex);
        }
        return buildError(HttpStatus.SERVICE_UNAVAILABLE, ApiError.Code.ENGINE_UNAVAILABLE, ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, ApiError.Code.INTERNAL_ERROR, "Unexpected error", List.of(), request, ex);
    }

    private ApiErrorDetail toDetail(FieldError error) {
        return ApiErrorDetail.builder()
                .field(error.getField())
                .issue(error.getDefaultMessage())
                .build();
    }

    private ResponseEntity<ApiError> buildError(HttpStatus status, ApiError.Code code, String message,
                                                List<ApiErrorDetail> details, HttpServletRequest request, Exception ex) {
        ApiError error = ApiError.builder()
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .status(status.value())
                .error(status.getReasonPhrase())
                .code(code)
                .message(message)
                .jobName(MDC.get(RequestCorrelationFilter.MDC_JOB_NAME))
                .retryable(code == ApiError.Code.ENGINE_TIMEOUT || code == ApiError.Code.ENGINE_UNAVAILABLE
                        || code == ApiError.Code.STALE_WRITE)
                .requestId(MDC.get(RequestCorrelationFilter.MDC_REQUEST_ID))
                .correlationId(MDC.get(RequestCorrelationFilter.MDC_CORRELATION_ID))
                .details(details)
                .build();
        if (status.is5xxServerError()) {
            log.error("{} {} -> {} {} {}", request.getMethod(), request.getRequestURI(), status.value(), code, message, ex);
        } else {
            log.warn("{} {} -> {} {} {}", request.getMethod(), request.getRequestURI(), status.value(), code, message);
        }
        return ResponseEntity.status(status).body(error);
    }
}

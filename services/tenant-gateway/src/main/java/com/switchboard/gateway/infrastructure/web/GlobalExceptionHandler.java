package com.switchboard.gateway.infrastructure.web;

import com.switchboard.gateway.api.EmployeeNotFoundException;
import com.switchboard.tenancy.TenantAccessException;
import com.switchboard.tenancy.TenantMismatchException;
import com.switchboard.tenancy.TenantValidationException;
import com.switchboard.tenancy.lifecycle.TenantNotFoundException;
import com.switchboard.tenancy.lifecycle.TenantTransitionException;
import com.switchboard.tenancy.registry.DuplicateTenantException;
import com.switchboard.tenancy.store.StoreSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global exception handler that maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <p>Every problem carries {@code timestamp} and {@code correlationId} properties so support can
 * find the request in the logs:
 *
 * <pre>
 * {
 *   "type": "https://switchboard.dev/errors/transition-conflict",
 *   "title": "Transition Conflict",
 *   "status": 409,
 *   "detail": "Tenant t-42 cannot move to SUSPENDED: it is RETIRED",
 *   "timestamp": "2026-03-01T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Tenant access failures raised inside a controller (a store that breaks mid-request) use the
 * same {@link TenantProblemMapper} as the binding filter, so clients see one format.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final TenantProblemMapper problems;

    public GlobalExceptionHandler(TenantProblemMapper problems) {
        this.problems = problems;
    }

    @ExceptionHandler(TenantAccessException.class)
    public ResponseEntity<ProblemDetail> handleTenantAccess(TenantAccessException ex) {
        log.warn("Tenant access failed ({}): {}", ex.failure().code(), ex.getMessage());
        return problems.toResponse(ex);
    }

    @ExceptionHandler(StoreSessionException.class)
    public ResponseEntity<ProblemDetail> handleStoreSession(StoreSessionException ex) {
        log.warn("Store {} failed during the request: {}", ex.storeName(), ex.getMessage());
        ProblemDetail problem =
                TenantProblemMapper.problem(
                        HttpStatus.SERVICE_UNAVAILABLE,
                        "store-unavailable",
                        "Tenant Store Unavailable",
                        "The tenant store failed while serving the request");
        problem.setProperty(TenantProblemMapper.FAILURE_PROPERTY, "store_unavailable");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, problems.retryAfterSeconds())
                .body(problem);
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ProblemDetail handleTenantMismatch(TenantMismatchException ex) {
        log.error("Cross-tenant access blocked: {}", ex.getMessage());
        return TenantProblemMapper.problem(
                HttpStatus.FORBIDDEN, "tenant-mismatch", "Tenant Mismatch", "Access denied");
    }

    @ExceptionHandler(TenantValidationException.class)
    public ProblemDetail handleTenantValidation(TenantValidationException ex) {
        log.warn("Tenant validation failed: {}", ex.errors());
        ProblemDetail problem =
                TenantProblemMapper.problem(
                        HttpStatus.BAD_REQUEST, "validation", "Validation Error", ex.getMessage());
        problem.setProperty("errors", ex.errors());
        return problem;
    }

    @ExceptionHandler(DuplicateTenantException.class)
    public ProblemDetail handleDuplicate(DuplicateTenantException ex) {
        log.warn("Duplicate tenant: {}", ex.getMessage());
        return TenantProblemMapper.problem(
                HttpStatus.CONFLICT, "duplicate-tenant", "Duplicate Tenant", ex.getMessage());
    }

    @ExceptionHandler(TenantTransitionException.class)
    public ProblemDetail handleTransition(TenantTransitionException ex) {
        log.warn("Lifecycle transition refused: {}", ex.getMessage());
        ProblemDetail problem =
                TenantProblemMapper.problem(
                        HttpStatus.CONFLICT, "transition-conflict", "Transition Conflict", ex.getMessage());
        problem.setProperty("tenantId", ex.tenantId());
        if (ex.actual() != null) {
            problem.setProperty("actualStatus", ex.actual().name());
        }
        return problem;
    }

    @ExceptionHandler(TenantNotFoundException.class)
    public ProblemDetail handleTenantNotFound(TenantNotFoundException ex) {
        return TenantProblemMapper.problem(
                HttpStatus.NOT_FOUND, "tenant-not-found", "Tenant Not Found", ex.getMessage());
    }

    @ExceptionHandler(EmployeeNotFoundException.class)
    public ProblemDetail handleEmployeeNotFound(EmployeeNotFoundException ex) {
        return TenantProblemMapper.problem(
                HttpStatus.NOT_FOUND, "not-found", "Not Found", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return TenantProblemMapper.problem(
                HttpStatus.BAD_REQUEST, "bad-request", "Bad Request", ex.getMessage());
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ProblemDetail handleUnreadable(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return TenantProblemMapper.problem(
                HttpStatus.BAD_REQUEST, "bad-request", "Bad Request", "Malformed request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return TenantProblemMapper.problem(
                HttpStatus.BAD_REQUEST, "validation", "Validation Error", detail);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ProblemDetail handleNoResource(NoResourceFoundException ex) {
        return TenantProblemMapper.problem(
                HttpStatus.NOT_FOUND, "not-found", "Not Found", ex.getMessage());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ProblemDetail handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return TenantProblemMapper.problem(
                HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed", "Method Not Allowed", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return TenantProblemMapper.problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "internal",
                "Internal Server Error",
                "An unexpected error occurred");
    }
}

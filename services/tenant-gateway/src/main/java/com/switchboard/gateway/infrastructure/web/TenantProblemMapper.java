package com.switchboard.gateway.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.observability.CorrelationContextHolder;
import com.switchboard.tenancy.TenantAccessException;
import com.switchboard.tenancy.TenantFailure;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

/**
 * Maps tenant access failures to RFC 7807 responses.
 *
 * <p>Every problem carries a {@code failure} property with the stable failure code
 * ({@code not_found}, {@code pool_exhausted}, ...) so clients can branch on it without parsing
 * titles. Retryable failures get a {@code Retry-After} header.
 *
 * <table>
 *   <caption>Status per failure</caption>
 *   <tr><td>not_found</td><td>404</td></tr>
 *   <tr><td>not_ready</td><td>503 + Retry-After</td></tr>
 *   <tr><td>suspended</td><td>403</td></tr>
 *   <tr><td>retired</td><td>410</td></tr>
 *   <tr><td>store_unavailable</td><td>503 + Retry-After</td></tr>
 *   <tr><td>pool_exhausted</td><td>429 + Retry-After</td></tr>
 *   <tr><td>cancelled</td><td>503</td></tr>
 * </table>
 */
public class TenantProblemMapper {

    /** Base of every problem {@code type} URI. */
    public static final String PROBLEM_TYPE_BASE = "https://switchboard.dev/errors/";

    /** Problem property holding the failure code. */
    public static final String FAILURE_PROPERTY = "failure";

    private final Duration retryAfter;

    public TenantProblemMapper(Duration retryAfter) {
        if (retryAfter == null || retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be non-negative");
        }
        this.retryAfter = retryAfter;
    }

    public HttpStatus statusOf(TenantFailure failure) {
        return switch (failure) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case NOT_READY, STORE_UNAVAILABLE, CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
            case SUSPENDED -> HttpStatus.FORBIDDEN;
            case RETIRED -> HttpStatus.GONE;
            case POOL_EXHAUSTED -> HttpStatus.TOO_MANY_REQUESTS;
        };
    }

    public ProblemDetail toProblem(TenantAccessException ex) {
        TenantFailure failure = ex.failure();
        ProblemDetail problem =
                problem(
                        statusOf(failure),
                        failure.code().replace('_', '-'),
                        titleOf(failure),
                        ex.getMessage());
        problem.setProperty(FAILURE_PROPERTY, failure.code());
        problem.setProperty("retryable", failure.retryable());
        return problem;
    }

    public ResponseEntity<ProblemDetail> toResponse(TenantAccessException ex) {
        ProblemDetail problem = toProblem(ex);
        var builder = ResponseEntity.status(problem.getStatus());
        if (ex.retryable()) {
            builder.header(HttpHeaders.RETRY_AFTER, retryAfterSeconds());
        }
        return builder.contentType(MediaType.APPLICATION_PROBLEM_JSON).body(problem);
    }

    /**
     * Writes the problem straight to the servlet response, for filters that run outside
     * Spring MVC's exception handling.
     */
    public void write(HttpServletResponse response, TenantAccessException ex, ObjectMapper objectMapper)
            throws IOException {
        ResponseEntity<ProblemDetail> entity = toResponse(ex);
        response.setStatus(entity.getStatusCode().value());
        entity.getHeaders().forEach((name, values) -> values.forEach(v -> response.addHeader(name, v)));
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), entity.getBody());
    }

    /** The {@code Retry-After} value, in whole seconds (at least 1). */
    public String retryAfterSeconds() {
        long seconds = Math.max(1, (retryAfter.toMillis() + 999) / 1000);
        return Long.toString(seconds);
    }

    /**
     * Builds a problem with the gateway's type URI scheme, a timestamp and the request's
     * correlation ID.
     */
    public static ProblemDetail problem(HttpStatus status, String slug, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(PROBLEM_TYPE_BASE + slug));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }

    private static String titleOf(TenantFailure failure) {
        return switch (failure) {
            case NOT_FOUND -> "Unknown Tenant";
            case NOT_READY -> "Tenant Not Ready";
            case SUSPENDED -> "Tenant Suspended";
            case RETIRED -> "Tenant Retired";
            case STORE_UNAVAILABLE -> "Tenant Store Unavailable";
            case POOL_EXHAUSTED -> "Tenant Pool Exhausted";
            case CANCELLED -> "Request Cancelled";
        };
    }
}

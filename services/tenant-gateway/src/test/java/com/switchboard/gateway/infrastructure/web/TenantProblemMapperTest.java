package com.switchboard.gateway.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.switchboard.tenancy.PoolExhaustedException;
import com.switchboard.tenancy.TenantFailure;
import com.switchboard.tenancy.TenantRetiredException;
import com.switchboard.tenancy.UnknownTenantException;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

@DisplayName("TenantProblemMapper")
class TenantProblemMapperTest {

    private final TenantProblemMapper mapper = new TenantProblemMapper(Duration.ofMillis(1500));

    @Test
    @DisplayName("maps every failure to its status")
    void statusPerFailure() {
        assertThat(mapper.statusOf(TenantFailure.NOT_FOUND)).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(mapper.statusOf(TenantFailure.NOT_READY)).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(mapper.statusOf(TenantFailure.SUSPENDED)).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(mapper.statusOf(TenantFailure.RETIRED)).isEqualTo(HttpStatus.GONE);
        assertThat(mapper.statusOf(TenantFailure.STORE_UNAVAILABLE)).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(mapper.statusOf(TenantFailure.POOL_EXHAUSTED)).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(mapper.statusOf(TenantFailure.CANCELLED)).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ParameterizedTest
    @EnumSource(TenantFailure.class)
    @DisplayName("every failure has a status in the 4xx or 5xx range")
    void everyFailureIsAnError(TenantFailure failure) {
        assertThat(mapper.statusOf(failure).isError()).isTrue();
    }

    @Test
    @DisplayName("problem carries failure code, retryable flag and type URI")
    void problemProperties() {
        var problem = mapper.toProblem(new UnknownTenantException("nobody"));

        assertThat(problem.getStatus()).isEqualTo(404);
        assertThat(problem.getType().toString()).isEqualTo(TenantProblemMapper.PROBLEM_TYPE_BASE + "not-found");
        assertThat(problem.getProperties())
                .containsEntry(TenantProblemMapper.FAILURE_PROPERTY, "not_found")
                .containsEntry("retryable", false)
                .containsKey("timestamp");
    }

    @Test
    @DisplayName("retryable failures get Retry-After rounded up to whole seconds")
    void retryableHasRetryAfter() {
        var response = mapper.toResponse(new PoolExhaustedException("t-1", Duration.ofMillis(200)));

        assertThat(response.getStatusCode().value()).isEqualTo(429);
        assertThat(response.getHeaders().getFirst("Retry-After")).isEqualTo("2");
        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_PROBLEM_JSON);
    }

    @Test
    @DisplayName("final failures have no Retry-After")
    void finalHasNoRetryAfter() {
        var response = mapper.toResponse(new TenantRetiredException("t-1"));

        assertThat(response.getStatusCode().value()).isEqualTo(410);
        assertThat(response.getHeaders().containsKey("Retry-After")).isFalse();
    }

    @Test
    @DisplayName("Retry-After is at least one second")
    void retryAfterAtLeastOneSecond() {
        assertThat(new TenantProblemMapper(Duration.ZERO).retryAfterSeconds()).isEqualTo("1");
    }

    @Test
    @DisplayName("rejects negative retry-after")
    void rejectsNegative() {
        assertThatThrownBy(() -> new TenantProblemMapper(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

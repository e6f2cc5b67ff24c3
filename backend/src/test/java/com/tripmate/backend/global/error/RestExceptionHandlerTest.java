package com.tripmate.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import com.tripmate.backend.global.web.RequestIdFilter;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RestExceptionHandlerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

    private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/auth/login");

    @Test
    void problemKeepsItsStatusAndCode() {
        ResponseEntity<ProblemResponse> response = new RestExceptionHandler(CLOCK, false)
                .handleProblem(new ProblemException(ErrorCode.INVALID_CREDENTIALS), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody().success()).isFalse();
        assertThat(response.getBody().code()).isEqualTo("INVALID_CREDENTIALS");
        assertThat(response.getBody().message()).isEqualTo("Invalid email or password");
        assertThat(response.getBody().timestamp()).isEqualTo("2025-01-01T00:00Z");
        assertThat(response.getBody().path()).isEqualTo("/api/auth/login");
    }

    @Test
    void problemBodyCarriesTheRequestId() throws Exception {
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "req-12345678");
        new RequestIdFilter().doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        ResponseEntity<ProblemResponse> response = new RestExceptionHandler(CLOCK, false)
                .handleProblem(new ProblemException(ErrorCode.NOT_FOUND), request);

        assertThat(response.getBody().requestId()).isEqualTo("req-12345678");
    }

    @Test
    void retryableProblemCarriesRetryAfter() {
        ResponseEntity<ProblemResponse> response = new RestExceptionHandler(CLOCK, false)
                .handleRetryable(new RetryableProblemException(ErrorCode.TOO_MANY_REQUESTS, 30), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getHeaders().getFirst("Retry-After")).isEqualTo("30");
    }

    @Test
    void unexpectedErrorsAreSanitized() {
        ResponseEntity<ProblemResponse> response = new RestExceptionHandler(CLOCK, false)
                .handleUnexpected(new IllegalStateException("connection string leaked"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().message()).isEqualTo("Internal server error");
        assertThat(response.getBody().trace()).isNull();
    }

    @Test
    void stackTraceIsIncludedOnlyWhenEnabled() {
        ResponseEntity<ProblemResponse> response = new RestExceptionHandler(CLOCK, true)
                .handleUnexpected(new IllegalStateException("boom"), request);

        assertThat(response.getBody().trace()).contains("IllegalStateException", "boom");
    }
}

package com.tripmate.backend.global.error;

import java.io.IOException;
import java.time.Clock;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Writes {@link ProblemResponse} bodies from code that runs before the dispatcher servlet, where
 * {@link RestExceptionHandler} cannot reach.
 */
@Component
public class ProblemResponseWriter {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ProblemResponseWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void write(HttpServletRequest request, HttpServletResponse response, ProblemException problem)
            throws IOException {
        if (problem instanceof RetryableProblemException retryable) {
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryable.getRetryAfterSeconds()));
        }
        write(request, response, problem.getErrorCode(), problem.getMessage());
    }

    public void write(HttpServletRequest request, HttpServletResponse response, ErrorCode errorCode, String message)
            throws IOException {
        ProblemResponse body = ProblemResponse.of(errorCode, message, request, clock);
        response.setStatus(errorCode.getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}

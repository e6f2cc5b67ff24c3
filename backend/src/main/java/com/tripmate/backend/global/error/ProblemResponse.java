package com.tripmate.backend.global.error;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tripmate.backend.global.web.RequestIdFilter;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Error envelope shared by controllers and servlet filters.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemResponse(
        boolean success,
        String code,
        String message,
        String timestamp,
        String path,
        String requestId,
        String trace
) {

    public static ProblemResponse of(ErrorCode errorCode, String message, HttpServletRequest request, Clock clock) {
        String safeMessage = (message != null && !message.isBlank()) ? message : errorCode.getDefaultMessage();
        return new ProblemResponse(false, errorCode.name(), safeMessage, OffsetDateTime.now(clock).toString(),
                request.getRequestURI(), RequestIdFilter.currentRequestId(request), null);
    }

    public ProblemResponse withTrace(String trace) {
        return new ProblemResponse(success, code, message, timestamp, path, requestId, trace);
    }
}

package com.tripmate.backend.global.error;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    private final Clock clock;
    private final boolean includeStacktrace;

    public RestExceptionHandler(Clock clock, @Value("${app.errors.include-stacktrace:false}") boolean includeStacktrace) {
        this.clock = clock;
        this.includeStacktrace = includeStacktrace;
    }

    @ExceptionHandler(RetryableProblemException.class)
    public ResponseEntity<ProblemResponse> handleRetryable(RetryableProblemException ex, HttpServletRequest request) {
        return ResponseEntity.status(ex.getErrorCode().getStatus())
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(ProblemResponse.of(ex.getErrorCode(), ex.getMessage(), request, clock));
    }

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<ProblemResponse> handleProblem(ProblemException ex, HttpServletRequest request) {
        ErrorCode code = ex.getErrorCode();
        if (code.getStatus().is5xxServerError()) {
            log.warn("Request {} failed with {}: {}", request.getRequestURI(), code, ex.getMessage(), ex);
        }
        return ResponseEntity.status(code.getStatus())
                .body(ProblemResponse.of(code, ex.getMessage(), request, clock));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemResponse> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        StringBuilder sb = new StringBuilder();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            sb.append(fieldError.getField()).append(": ").append(fieldError.getDefaultMessage()).append("; ");
        }
        String detail = sb.length() > 0 ? sb.substring(0, sb.length() - 2) : ErrorCode.VALIDATION_FAILED.getDefaultMessage();
        return ResponseEntity.status(ErrorCode.VALIDATION_FAILED.getStatus())
                .body(ProblemResponse.of(ErrorCode.VALIDATION_FAILED, detail, request, clock));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return ResponseEntity.status(ErrorCode.BAD_REQUEST.getStatus())
                .body(ProblemResponse.of(ErrorCode.BAD_REQUEST, "Malformed request body", request, clock));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {}", request.getRequestURI(), ex);
        ProblemResponse body = ProblemResponse.of(ErrorCode.INTERNAL_ERROR, null, request, clock);
        if (includeStacktrace) {
            body = body.withTrace(stackTraceOf(ex));
        }
        return ResponseEntity.status(ErrorCode.INTERNAL_ERROR.getStatus()).body(body);
    }

    private static String stackTraceOf(Throwable ex) {
        StringWriter writer = new StringWriter();
        ex.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}

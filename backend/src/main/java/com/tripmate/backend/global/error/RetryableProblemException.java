package com.tripmate.backend.global.error;

public class RetryableProblemException extends ProblemException {

    private final long retryAfterSeconds;

    public RetryableProblemException(ErrorCode errorCode, String message, long retryAfterSeconds) {
        super(errorCode, message);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public RetryableProblemException(ErrorCode errorCode, long retryAfterSeconds) {
        this(errorCode, null, retryAfterSeconds);
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}

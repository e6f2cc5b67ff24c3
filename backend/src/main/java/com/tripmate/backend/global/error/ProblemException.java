package com.tripmate.backend.global.error;

public class ProblemException extends RuntimeException {

    private final ErrorCode errorCode;

    public ProblemException(ErrorCode errorCode) {
        this(errorCode, null, null);
    }

    public ProblemException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public ProblemException(ErrorCode errorCode, String message, Throwable cause) {
        super(message != null && !message.isBlank() ? message : requireCode(errorCode).getDefaultMessage(), cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    private static ErrorCode requireCode(ErrorCode errorCode) {
        if (errorCode == null) {
            throw new IllegalArgumentException("ProblemException errorCode must not be null");
        }
        return errorCode;
    }
}

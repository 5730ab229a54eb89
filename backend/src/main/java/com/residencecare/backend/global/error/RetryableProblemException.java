package com.residencecare.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * A failure the caller may safely repeat: nothing was applied.
 */
public class RetryableProblemException extends ProblemException {

    private final int retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, int retryAfterSeconds, Throwable cause) {
        super(status, code, detail, cause);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public RetryableProblemException(HttpStatus status, String code, String detail, int retryAfterSeconds) {
        this(status, code, detail, retryAfterSeconds, null);
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}

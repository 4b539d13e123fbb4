package com.numbertrack.backend.global.error;

import java.time.Duration;

import org.springframework.http.HttpStatus;

/**
 * 503 raised when a bounded resource (the verification worker queue) is saturated.
 * The handler adds a {@code Retry-After} header.
 */
public class RetryableProblemException extends ProblemException {

    private final Duration retryAfter;

    public RetryableProblemException(String code, String detail, Duration retryAfter) {
        super(HttpStatus.SERVICE_UNAVAILABLE, code, detail);
        if (retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must not be negative");
        }
        this.retryAfter = retryAfter;
    }

    public long getRetryAfterSeconds() {
        return retryAfter.toSeconds();
    }
}

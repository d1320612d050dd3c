package com.flightops.diversion.exception;

import lombok.Getter;

/**
 * Root of the failures the diversion core reports. {@code errorCode} is stable for callers to
 * branch on; {@code retryable} is set only where the same call may succeed later, such as a
 * data feed outage.
 */
@Getter
public abstract class DiversionException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;

    protected DiversionException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, retryable, null);
    }

    protected DiversionException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
}

package com.venueops.common.exception;

/**
 * Coarse error taxonomy shared by every {@link ErrorCode}. Callers branch on the type,
 * not on individual codes, to decide whether to retry, re-read or prompt the user.
 */
public enum ErrorType {
    VALIDATION,
    NOT_FOUND,
    ACCESS_DENIED,
    CONFLICT,
    INVALID_STATE,
    PAYMENT_NOT_CONFIRMED,
    UPSTREAM_TIMEOUT,
    INTERNAL;

    public boolean isRetryable() {
        return this == CONFLICT || this == UPSTREAM_TIMEOUT;
    }
}

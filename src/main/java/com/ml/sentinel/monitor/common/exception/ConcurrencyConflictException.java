package com.ml.sentinel.monitor.common.exception;

/**
 * The retrain lease is held by another invocation.
 */
public class ConcurrencyConflictException extends BaseSentinelException {
    private static final String DEFAULT_ERROR_CODE = "ERR-LOCK-001";

    public ConcurrencyConflictException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

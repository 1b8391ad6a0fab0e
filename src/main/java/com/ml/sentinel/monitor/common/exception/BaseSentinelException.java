package com.ml.sentinel.monitor.common.exception;

import lombok.Getter;

/**
 * Base exception for the monitoring service. Carries a stable error code
 * that ends up in logs and alert text.
 */
@Getter
public abstract class BaseSentinelException extends RuntimeException {

    private final String errorCode;

    protected BaseSentinelException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseSentinelException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}

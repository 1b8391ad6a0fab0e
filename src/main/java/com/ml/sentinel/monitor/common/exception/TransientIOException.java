package com.ml.sentinel.monitor.common.exception;

import lombok.Getter;

/**
 * Network error, timeout or non-2xx answer from an external collaborator.
 * Recovered inside the tick that hit it.
 */
@Getter
public class TransientIOException extends BaseSentinelException {
    private static final String DEFAULT_ERROR_CODE = "ERR-IO-001";

    /**
     * HTTP status of the failed answer, 0 when no answer was received.
     */
    private final int httpStatus;

    public TransientIOException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, 0, cause);
    }

    public TransientIOException(String errorCode, String message, int httpStatus, Throwable cause) {
        super(errorCode, message, cause);
        this.httpStatus = httpStatus;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

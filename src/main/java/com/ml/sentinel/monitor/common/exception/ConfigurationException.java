package com.ml.sentinel.monitor.common.exception;

/**
 * Invalid threshold, interval or timeout detected at startup. Fatal: the
 * application context refuses to start.
 */
public class ConfigurationException extends BaseSentinelException {
    private static final String DEFAULT_ERROR_CODE = "ERR-CFG-001";

    public ConfigurationException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

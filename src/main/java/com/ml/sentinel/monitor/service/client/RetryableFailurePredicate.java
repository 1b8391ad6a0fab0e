package com.ml.sentinel.monitor.service.client;

import com.ml.sentinel.monitor.common.constants.SentinelConsts;
import com.ml.sentinel.monitor.common.exception.TransientIOException;

import java.util.function.Predicate;

/**
 * Retry only failures that another attempt could fix: timeouts, connection
 * errors and 5xx. A 4xx is answered the same way every time.
 * Referenced from {@code resilience4j.retry.configs.default.retry-exception-predicate}.
 */
public class RetryableFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable t) {
        if (!(t instanceof TransientIOException)) {
            return false;
        }
        return !SentinelConsts.ERR_HTTP_CLIENT.equals(((TransientIOException) t).getErrorCode());
    }
}

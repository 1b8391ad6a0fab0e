package com.ml.sentinel.monitor.service.retrain;

import com.ml.sentinel.monitor.common.constants.SentinelConsts;
import com.ml.sentinel.monitor.common.exception.ConcurrencyConflictException;
import com.ml.sentinel.monitor.core.FastStateStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.UUID;

/**
 * Exclusive "retrain in progress" lease. The lease expires on its own after
 * {@code staleAfter}, so an attempt that died without releasing cannot block
 * retraining forever. Only the owner token can release it.
 */
@Slf4j
public class RetrainLock {

    private final FastStateStore store;
    private final Duration staleAfter;

    public RetrainLock(FastStateStore store, Duration staleAfter) {
        this.store = store;
        this.staleAfter = staleAfter;
    }

    /**
     * @throws ConcurrencyConflictException if another attempt holds the lease
     */
    public Lease acquire(String owner) {
        String token = owner + ":" + UUID.randomUUID();
        if (!store.setIfAbsent(SentinelConsts.RETRAIN_LOCK_KEY, token, staleAfter)) {
            String holder = store.get(SentinelConsts.RETRAIN_LOCK_KEY).orElse("?");
            throw new ConcurrencyConflictException("Retrain already in progress (held by " + holder + ")");
        }
        log.debug("Retrain lease acquired by {} for at most {}", token, staleAfter);
        return new Lease(token);
    }

    public boolean isHeld() {
        return store.get(SentinelConsts.RETRAIN_LOCK_KEY).isPresent();
    }

    public final class Lease implements AutoCloseable {
        private final String token;

        private Lease(String token) {
            this.token = token;
        }

        public String token() {
            return token;
        }

        @Override
        public void close() {
            if (!store.deleteIfValue(SentinelConsts.RETRAIN_LOCK_KEY, token)) {
                log.warn("Retrain lease {} had already expired before release", token);
            }
        }
    }
}

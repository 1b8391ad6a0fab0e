package com.ml.sentinel.monitor.core;

import java.time.Duration;
import java.util.Optional;

/**
 * A tiny abstraction over a fast key-value store with TTL semantics.
 * Used for the retrain lease, where the TTL doubles as a staleness bound.
 *
 * Contracts:
 *  - All methods are thread-safe.
 *  - TTL of null or non-positive means "no expiry".
 */
public interface FastStateStore {

    Optional<String> get(String key);

    // Atomic "set if absent" with TTL (leases)
    boolean setIfAbsent(String key, String value, Duration ttl);

    // Atomic delete only while the key still holds the given value (lease release by owner)
    boolean deleteIfValue(String key, String value);
}

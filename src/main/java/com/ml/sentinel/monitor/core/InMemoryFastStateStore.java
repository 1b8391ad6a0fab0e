package com.ml.sentinel.monitor.core;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of FastStateStore (single JVM).
 */
public final class InMemoryFastStateStore implements FastStateStore {

    private static final class Entry {
        final String v;
        final long expAtMillis; // 0 = no expiry

        Entry(String v, long expAtMillis) {
            this.v = v;
            this.expAtMillis = expAtMillis;
        }
    }

    private final ConcurrentMap<String, Entry> map = new ConcurrentHashMap<>();
    private final String prefix; // e.g., "ms:"
    private final Clock clock;

    public InMemoryFastStateStore(String prefix, Clock clock) {
        this.prefix = prefix == null ? "" : prefix;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    private long now() {
        return clock.millis();
    }

    private static boolean isExpired(Entry e, long now) {
        return e != null && e.expAtMillis > 0 && now >= e.expAtMillis;
    }

    private static long expiry(Duration ttl, long now) {
        return (ttl == null || ttl.isZero() || ttl.isNegative()) ? 0L : (now + ttl.toMillis());
    }

    private String k(String key) {
        return prefix + key;
    }

    @Override
    public Optional<String> get(String key) {
        final String kk = k(key);
        final Entry e = map.get(kk);
        if (e == null) return Optional.empty();
        if (isExpired(e, now())) {
            map.remove(kk, e);
            return Optional.empty();
        }
        return Optional.ofNullable(e.v);
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        final String kk = k(key);
        final long n = now();
        final Entry fresh = new Entry(value, expiry(ttl, n));

        for (; ; ) {
            final Entry existing = map.get(kk);
            if (existing == null) {
                if (map.putIfAbsent(kk, fresh) == null) {
                    return true;
                }
                // lost race; retry
                continue;
            }
            if (!isExpired(existing, n)) {
                return false;
            }
            // expired: try to take it over
            if (map.replace(kk, existing, fresh)) {
                return true;
            }
        }
    }

    @Override
    public boolean deleteIfValue(String key, String value) {
        final String kk = k(key);
        final Entry e = map.get(kk);
        if (e == null || isExpired(e, now()) || !Objects.equals(e.v, value)) {
            return false;
        }
        return map.remove(kk, e);
    }
}

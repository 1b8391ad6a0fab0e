package com.ml.sentinel.monitor.common;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.function.Consumer;

/**
 * Outcome of a call to an external collaborator. Failures are values here,
 * not exceptions: a tick inspects them and degrades to a safe default.
 */
@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;
    private final Instant timestamp;

    private Result(boolean success, T data, String error, String errorCode) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
        this.timestamp = Instant.now();
    }

    // ---------- factories ----------
    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null);
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code);
    }

    public static <T> Result<T> fail(String code, Throwable t) {
        String msg = (t == null)
                ? "Unknown error"
                : (t.getMessage() == null ? t.toString() : t.getMessage());
        return new Result<>(false, null, msg, code);
    }

    // ---------- convenience helpers ----------

    public boolean isOk() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Alias for the payload (same as getData()).
     */
    public T get() {
        return data;
    }

    public void ifFailure(Consumer<? super String> consumer) {
        if (isFailure()) consumer.accept(error);
    }
}

package com.ibstrader.exchange;

import java.util.function.Function;

/**
 * Outcome of one exchange call: either a typed payload or a failure reason.
 *
 * <p>Transient failures (network, timeouts, 5xx, open circuit) are flagged so callers can
 * tell "the exchange did not answer" from "the exchange said no".
 */
public final class GatewayResult<T> {

    private static final String UNKNOWN_REASON = "unknown error";

    private final boolean ok;
    private final T value;
    private final String reason;
    private final boolean transientFailure;

    private GatewayResult(boolean ok, T value, String reason, boolean transientFailure) {
        this.ok = ok;
        this.value = value;
        this.reason = reason;
        this.transientFailure = transientFailure;
    }

    public static <T> GatewayResult<T> ok(T value) {
        return new GatewayResult<>(true, value, null, false);
    }

    /** Ok result without payload, for calls that only acknowledge. */
    public static GatewayResult<Void> done() {
        return new GatewayResult<>(true, null, null, false);
    }

    /** Failed result; a null reason is recorded as {@code "unknown error"}. */
    public static <T> GatewayResult<T> err(String reason, boolean transientFailure) {
        return new GatewayResult<>(false, null, reason != null ? reason : UNKNOWN_REASON, transientFailure);
    }

    public boolean isOk() {
        return ok;
    }

    public boolean isErr() {
        return !ok;
    }

    /** The payload; only valid when {@link #isOk()}. */
    public T getValue() {
        if (isErr()) {
            throw new IllegalStateException("No value on failed result: " + reason);
        }
        return value;
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }

    public String getReason() {
        return reason;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }

    public <R> GatewayResult<R> map(Function<? super T, ? extends R> mapper) {
        if (isErr()) {
            return err(reason, transientFailure);
        }
        return ok(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + value + ")" : "Err(" + reason + (transientFailure ? ", transient)" : ")");
    }
}

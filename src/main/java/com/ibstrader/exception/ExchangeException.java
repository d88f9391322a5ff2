package com.ibstrader.exception;

/**
 * Raised by exchange adapters for any failed call. {@code transientFailure} separates
 * transport problems (timeouts, 5xx, unreadable bodies) from business rejections the
 * exchange returned deliberately ({@code status: err}, per-order error statuses).
 */
public class ExchangeException extends BaseException {

    private final boolean transientFailure;

    private ExchangeException(ErrorCode errorCode, String message, boolean transientFailure, Throwable cause) {
        super(errorCode, message, cause);
        this.transientFailure = transientFailure;
    }

    public static ExchangeException rejected(String message) {
        return new ExchangeException(ErrorCode.EXCHANGE_REJECTED, message, false, null);
    }

    public static ExchangeException unavailable(String message, Throwable cause) {
        return new ExchangeException(ErrorCode.EXCHANGE_UNAVAILABLE, message, true, cause);
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}

package com.ibstrader.domain.enums;

/**
 * Terminal state of one chase (place + re-quote) loop.
 *
 * <p>RESTING_EXHAUSTED counts as success: the order is left live on the book and the
 * signal is marked executed so it is never re-submitted.
 */
public enum ChaseOutcome {
    FILLED(true),
    FILLED_FALLBACK(true),
    RESTING_EXHAUSTED(true),
    FAILED(false);

    private final boolean success;

    ChaseOutcome(boolean success) {
        this.success = success;
    }

    public boolean isSuccess() {
        return success;
    }
}

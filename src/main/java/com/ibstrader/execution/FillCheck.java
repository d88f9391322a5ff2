package com.ibstrader.execution;

/** What the fill detector could establish about a resting order. */
public enum FillCheck {
    /** Confirmed by order status or by the fill history. */
    FILLED,
    /** Inferred from the position having moved by the order size. */
    FILLED_FALLBACK,
    OPEN,
    /** Canceled or rejected on the exchange. */
    CANCELED,
    /** No status, no fill, no position change and not on the book. */
    LOST
}

package com.ibstrader.domain.enums;

/**
 * Order state as reported by the exchange's order-status lookup.
 * UNKNOWN means the exchange has not (yet) indexed the order id.
 */
public enum ExchangeOrderStatus {
    OPEN,
    FILLED,
    CANCELED,
    REJECTED,
    UNKNOWN;

    /** Maps Hyperliquid order status strings ("open", "filled", "canceled", "marginCanceled", ...). */
    public static ExchangeOrderStatus fromExchange(String status) {
        if (status == null) {
            return UNKNOWN;
        }
        String normalized = status.trim().toLowerCase();
        if (normalized.equals("open") || normalized.equals("triggered")) {
            return OPEN;
        }
        if (normalized.equals("filled")) {
            return FILLED;
        }
        if (normalized.equals("rejected") || normalized.endsWith("rejected")) {
            return REJECTED;
        }
        if (normalized.contains("cancel")) {
            return CANCELED;
        }
        return UNKNOWN;
    }
}

package com.ibstrader.domain.model;

/**
 * Reference to an exchange order by exchange-assigned id, client order id, or both.
 * Lookups prefer the client order id because it is known before the exchange answers.
 */
public record OrderRef(Long orderId, String clientOrderId) {

    public static OrderRef of(Long orderId, String clientOrderId) {
        return new OrderRef(orderId, clientOrderId);
    }

    public boolean matches(Long otherOrderId, String otherClientOrderId) {
        if (clientOrderId != null && clientOrderId.equalsIgnoreCase(otherClientOrderId)) {
            return true;
        }
        return orderId != null && orderId.equals(otherOrderId);
    }

    public OrderRef withOrderId(Long newOrderId) {
        return new OrderRef(newOrderId, clientOrderId);
    }

    @Override
    public String toString() {
        return "oid=" + orderId + ",cloid=" + clientOrderId;
    }
}

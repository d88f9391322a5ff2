package com.ibstrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** The exchange's immediate answer to a placement or modification. */
@Value
@Builder
public class OrderAck {

    public enum Status {
        FILLED,
        RESTING,
        ERROR
    }

    Status status;
    Long orderId;
    BigDecimal filledSize;
    BigDecimal averagePrice;
    String error;

    public static OrderAck filled(Long orderId, BigDecimal filledSize, BigDecimal averagePrice) {
        return OrderAck.builder()
                .status(Status.FILLED)
                .orderId(orderId)
                .filledSize(filledSize)
                .averagePrice(averagePrice)
                .build();
    }

    public static OrderAck resting(Long orderId) {
        return OrderAck.builder().status(Status.RESTING).orderId(orderId).build();
    }

    public static OrderAck error(String error) {
        return OrderAck.builder().status(Status.ERROR).error(error).build();
    }
}

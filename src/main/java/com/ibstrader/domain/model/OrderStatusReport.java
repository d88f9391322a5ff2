package com.ibstrader.domain.model;

import com.ibstrader.domain.enums.ExchangeOrderStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OrderStatusReport {

    ExchangeOrderStatus status;
    Long orderId;
    String clientOrderId;

    public static OrderStatusReport unknown() {
        return OrderStatusReport.builder().status(ExchangeOrderStatus.UNKNOWN).build();
    }
}

package com.ibstrader.simulator;

import com.ibstrader.domain.enums.ExchangeOrderStatus;
import com.ibstrader.domain.model.LimitOrderRequest;
import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;

/** A paper order and its mutable state. */
@Getter
@Setter
public class PaperOrder {

    private final long orderId;
    private LimitOrderRequest request;
    private ExchangeOrderStatus status = ExchangeOrderStatus.OPEN;
    private BigDecimal filledSize = BigDecimal.ZERO;

    public PaperOrder(long orderId, LimitOrderRequest request) {
        this.orderId = orderId;
        this.request = request;
    }
}

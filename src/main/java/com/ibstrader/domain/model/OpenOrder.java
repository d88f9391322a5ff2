package com.ibstrader.domain.model;

import com.ibstrader.domain.enums.TradeSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OpenOrder {

    Long orderId;
    String clientOrderId;
    String symbol;
    TradeSide side;
    BigDecimal limitPrice;
    BigDecimal size;
}

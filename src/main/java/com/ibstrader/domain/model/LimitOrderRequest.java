package com.ibstrader.domain.model;

import com.ibstrader.domain.enums.TradeSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** A GTC limit order as submitted (or re-priced) by the chase loop. */
@Value
@Builder(toBuilder = true)
public class LimitOrderRequest {

    String symbol;
    TradeSide side;
    BigDecimal size;
    BigDecimal price;
    boolean reduceOnly;

    /** Client order id (0x-prefixed 128-bit hex), fresh per placement attempt. */
    String clientOrderId;
}

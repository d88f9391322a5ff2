package com.ibstrader.domain.model;

import com.ibstrader.domain.enums.TradeSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** One execution from the account's recent fill history. */
@Value
@Builder
public class ExchangeFill {

    Long orderId;
    String clientOrderId;
    String symbol;
    TradeSide side;
    BigDecimal price;
    BigDecimal size;
    Instant time;
}

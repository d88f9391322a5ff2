package com.ibstrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** A live position. Size is signed: positive = long, negative = short. */
@Value
@Builder
public class ExchangePosition {

    String symbol;
    BigDecimal size;
    BigDecimal entryPrice;
}

package com.ibstrader.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** A fine-grained bar from the live candle stream, identified by its close time. */
@Value
@Builder
public class MinuteBar {

    Instant closeTime;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    BigDecimal volume;
}

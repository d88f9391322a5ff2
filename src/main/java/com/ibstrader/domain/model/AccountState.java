package com.ibstrader.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Snapshot of the trading account: margin that can be committed and the open positions. */
@Value
@Builder
public class AccountState {

    BigDecimal withdrawable;

    @Builder.Default
    List<ExchangePosition> positions = List.of();

    /** Signed size of the position in {@code symbol}, zero when there is none. */
    public BigDecimal positionSize(String symbol) {
        return positions.stream()
                .filter(p -> symbol.equalsIgnoreCase(p.getSymbol()))
                .map(ExchangePosition::getSize)
                .findFirst()
                .orElse(BigDecimal.ZERO);
    }
}

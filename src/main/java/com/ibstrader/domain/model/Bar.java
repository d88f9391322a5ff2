package com.ibstrader.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A finished aggregate bar, keyed by the ISO-8601 timestamp of its window end.
 * Immutable once stored; the id orders bars by insertion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Bar {

    private Long id;
    private String timestamp;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private BigDecimal volume;
}

package com.ibstrader.domain.model;

import com.ibstrader.domain.enums.ExecutionStatus;
import com.ibstrader.domain.enums.SignalAction;
import com.ibstrader.domain.enums.TradeSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A durable trade intent written by the decision process and consumed once by the
 * execution engine.
 *
 * <p>The id is assigned by the store and is monotonic, so ascending id order is arrival
 * order. {@code rawAction} keeps the stored action text so that a signal whose action
 * maps to {@link SignalAction#UNKNOWN} can be reported verbatim.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Signal {

    private Long id;

    /** ISO-8601 timestamp of the bar that produced this signal. */
    private String timestamp;

    private SignalAction action;
    private String rawAction;
    private String symbol;
    private TradeSide side;

    /** Reference price (bar close) at signal time. Informational; orders use the live mid. */
    private BigDecimal price;

    /** Leverage to apply before opening. Meaningful for OPEN only; defaults to 1. */
    private BigDecimal leverage;

    @Builder.Default
    private ExecutionStatus executionStatus = ExecutionStatus.PENDING;

    private LocalDateTime createdAt;
}

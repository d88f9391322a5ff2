package com.ibstrader.execution;

import com.ibstrader.domain.enums.ChaseOutcome;
import com.ibstrader.domain.model.OrderRef;
import lombok.Builder;
import lombok.Data;

/**
 * Result of one chase. {@code orderRef} is null when nothing reached the book;
 * {@code detail} explains failures.
 */
@Data
@Builder
public class ChaseResult {

    private ChaseOutcome outcome;
    private OrderRef orderRef;
    private int requotes;
    private String detail;

    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    public static ChaseResult of(ChaseOutcome outcome, OrderRef orderRef, int requotes) {
        return ChaseResult.builder().outcome(outcome).orderRef(orderRef).requotes(requotes).build();
    }

    public static ChaseResult failed(OrderRef orderRef, int requotes, String detail) {
        return ChaseResult.builder()
                .outcome(ChaseOutcome.FAILED)
                .orderRef(orderRef)
                .requotes(requotes)
                .detail(detail)
                .build();
    }
}

package com.ibstrader.exchange;

import com.ibstrader.exception.ExchangeException;
import java.util.function.Predicate;

/** Retry predicate for exchange reads: only transient failures are worth another attempt. */
public class TransientExchangeFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof ExchangeException exchangeException && exchangeException.isTransientFailure();
    }
}

package com.ibstrader.marketdata;

import com.ibstrader.domain.model.MinuteBar;
import java.util.Optional;

/**
 * The stream republishes the in-progress candle on every trade. This keeps the latest
 * update per close time and releases a candle only once a later one starts, so each
 * minute is folded into the aggregate exactly once.
 */
public class ClosedCandleFilter {

    private MinuteBar latest;

    /** Returns the candle that {@code update} has just closed, if any. */
    public synchronized Optional<MinuteBar> offer(MinuteBar update) {
        if (latest == null) {
            latest = update;
            return Optional.empty();
        }
        int order = update.getCloseTime().compareTo(latest.getCloseTime());
        if (order == 0) {
            latest = update;
            return Optional.empty();
        }
        if (order < 0) {
            // late update for an already released minute
            return Optional.empty();
        }
        MinuteBar closed = latest;
        latest = update;
        return Optional.of(closed);
    }

    public synchronized void reset() {
        latest = null;
    }
}

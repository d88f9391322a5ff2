package com.ibstrader.marketdata;

import com.ibstrader.config.TradingConfig;
import com.ibstrader.domain.model.Bar;
import com.ibstrader.domain.model.MinuteBar;
import com.ibstrader.observability.ExecutionMetrics;
import com.ibstrader.store.BarStore;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resamples fine bars into coarse bars of {@code ibstrader.strategy.window}, aligned to
 * the epoch, and writes each finished bar to the {@link BarStore}.
 *
 * <p>For a fine bar closing at T and an open coarse bar ending at E:
 * <ul>
 *   <li>no open bar: open one for the window containing T, seeded with the fine bar's open, then fold</li>
 *   <li>T &lt; E: fold (high max, low min, close latest, volume sum)</li>
 *   <li>T == E: fold, then flush</li>
 *   <li>T &gt; E: flush, then open and fold as for "no open bar"</li>
 * </ul>
 */
@Component
public class BarAggregator {

    private static final Logger log = LoggerFactory.getLogger(BarAggregator.class);

    private final BarStore barStore;
    private final TradingConfig tradingConfig;
    private final ExecutionMetrics executionMetrics;

    private RunningBar current;

    public BarAggregator(BarStore barStore, TradingConfig tradingConfig, ExecutionMetrics executionMetrics) {
        this.barStore = barStore;
        this.tradingConfig = tradingConfig;
        this.executionMetrics = executionMetrics;
    }

    /**
     * Folds one fine bar in.
     *
     * @return the coarse bar this call finished, if any (whether or not it was new to the store)
     */
    public synchronized Optional<Bar> onMinuteBar(MinuteBar bar) {
        Instant closeTime = bar.getCloseTime();
        Bar flushed = null;

        if (current != null && closeTime.isAfter(current.end)) {
            flushed = flush();
        }
        if (current == null) {
            current = open(bar);
        }
        current.fold(bar);
        if (closeTime.equals(current.end)) {
            flushed = flush();
        }
        return Optional.ofNullable(flushed);
    }

    /** Drops the in-progress bar, used when the stream reconnects after a gap. */
    public synchronized void discardInProgress() {
        if (current != null) {
            log.warn("Discarding in-progress bar: end={}", current.end);
            current = null;
        }
    }

    private RunningBar open(MinuteBar bar) {
        long windowMillis = tradingConfig.getStrategy().getWindow().toMillis();
        long closeMillis = bar.getCloseTime().toEpochMilli();
        long start = closeMillis - Math.floorMod(closeMillis, windowMillis);
        RunningBar running = new RunningBar(Instant.ofEpochMilli(start + windowMillis), bar.getOpen());
        log.debug("Opened aggregate bar: end={}, open={}", running.end, running.open);
        return running;
    }

    /** The bar stays in progress until the store has taken it, so a failed write is retried. */
    private Bar flush() {
        Bar bar = current.toBar();
        boolean inserted = barStore.insertIfAbsent(bar);
        current = null;
        if (inserted) {
            executionMetrics.recordBarFlushed();
        }
        return bar;
    }

    private static final class RunningBar {
        private final Instant end;
        private final BigDecimal open;
        private BigDecimal high;
        private BigDecimal low;
        private BigDecimal close;
        private BigDecimal volume = BigDecimal.ZERO;

        private RunningBar(Instant end, BigDecimal open) {
            this.end = end;
            this.open = open;
            this.high = open;
            this.low = open;
            this.close = open;
        }

        private void fold(MinuteBar bar) {
            high = high.max(bar.getHigh());
            low = low.min(bar.getLow());
            close = bar.getClose();
            volume = volume.add(bar.getVolume());
        }

        private Bar toBar() {
            return Bar.builder()
                    .timestamp(end.toString())
                    .open(open)
                    .high(high)
                    .low(low)
                    .close(close)
                    .volume(volume)
                    .build();
        }
    }
}

package com.ibstrader.observability;

import com.ibstrader.domain.enums.ChaseOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer meters for the trading pipeline.
 * <ul>
 *   <li><b>signals.executed</b> / <b>signals.failed</b> (counters): terminal signal transitions</li>
 *   <li><b>orders.requoted</b> (counter): successful price modifications in the chase loop</li>
 *   <li><b>bars.flushed</b> (counter): coarse bars written to the store</li>
 *   <li><b>chase.duration</b> (timer, tagged by outcome): wall time of one chase</li>
 * </ul>
 */
@Service
public class ExecutionMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter signalsExecutedCounter;
    private final Counter signalsFailedCounter;
    private final Counter ordersRequotedCounter;
    private final Counter barsFlushedCounter;

    public ExecutionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.signalsExecutedCounter = Counter.builder("signals.executed")
                .description("Signals moved to executed")
                .register(meterRegistry);
        this.signalsFailedCounter = Counter.builder("signals.failed")
                .description("Signals moved to failed")
                .register(meterRegistry);
        this.ordersRequotedCounter = Counter.builder("orders.requoted")
                .description("Resting orders re-priced to the current mid")
                .register(meterRegistry);
        this.barsFlushedCounter = Counter.builder("bars.flushed")
                .description("Aggregate bars written to the bar store")
                .register(meterRegistry);
    }

    public void recordSignalExecuted() {
        signalsExecutedCounter.increment();
    }

    public void recordSignalFailed() {
        signalsFailedCounter.increment();
    }

    public void recordRequote() {
        ordersRequotedCounter.increment();
    }

    public void recordBarFlushed() {
        barsFlushedCounter.increment();
    }

    public void recordChase(ChaseOutcome outcome, Duration elapsed) {
        Timer.builder("chase.duration")
                .description("Wall time from placement to a terminal chase outcome")
                .tag("outcome", outcome.name())
                .register(meterRegistry)
                .record(elapsed);
    }
}

package com.ibstrader.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Polls the signal store on a fixed delay. Enabled by {@code ibstrader.execution.enabled}. */
@Component
@ConditionalOnProperty(name = "ibstrader.execution.enabled", havingValue = "true", matchIfMissing = true)
public class ExecutionScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutionScheduler.class);

    private final SignalExecutionEngine signalExecutionEngine;

    public ExecutionScheduler(SignalExecutionEngine signalExecutionEngine) {
        this.signalExecutionEngine = signalExecutionEngine;
    }

    @Scheduled(
            initialDelayString = "#{@tradingConfig.execution.pollInterval.toMillis()}",
            fixedDelayString = "#{@tradingConfig.execution.pollInterval.toMillis()}")
    public void poll() {
        try {
            signalExecutionEngine.runOnce();
        } catch (RuntimeException e) {
            // store unreachable; the next poll tries again
            log.error("Execution pass failed: {}", e.getMessage(), e);
        }
    }
}

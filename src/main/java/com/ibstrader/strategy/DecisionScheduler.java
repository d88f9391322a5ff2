package com.ibstrader.strategy;

import com.ibstrader.config.TradingConfig;
import com.ibstrader.domain.model.Bar;
import com.ibstrader.store.BarStore;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Walks the bar store by increasing id and hands each new bar to the
 * {@link DecisionService}.
 *
 * <p>On startup the cursor is placed at the latest stored bar, so only bars written after
 * startup are acted on, and the in-trade flag is recovered. Enabled by
 * {@code ibstrader.strategy.enabled}.
 */
@Component
@ConditionalOnProperty(name = "ibstrader.strategy.enabled", havingValue = "true", matchIfMissing = true)
public class DecisionScheduler {

    private static final Logger log = LoggerFactory.getLogger(DecisionScheduler.class);

    private final BarStore barStore;
    private final DecisionService decisionService;
    private final TradingConfig tradingConfig;

    private volatile Long lastProcessedId;
    private volatile boolean initialized;

    public DecisionScheduler(BarStore barStore, DecisionService decisionService, TradingConfig tradingConfig) {
        this.barStore = barStore;
        this.decisionService = decisionService;
        this.tradingConfig = tradingConfig;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initialize() {
        lastProcessedId = barStore.findLatestId().orElse(null);
        if (tradingConfig.getStrategy().isRecoverStateOnStartup()) {
            decisionService.recoverState();
        }
        initialized = true;
        log.info("Decision loop ready: lastProcessedId={}, state={}", lastProcessedId, decisionService.getTradeState());
    }

    @Scheduled(
            initialDelayString = "#{@tradingConfig.strategy.pollInterval.toMillis()}",
            fixedDelayString = "#{@tradingConfig.strategy.pollInterval.toMillis()}")
    public void poll() {
        if (!initialized) {
            return;
        }
        try {
            Optional<Bar> next = barStore.findNextAfter(lastProcessedId);
            while (next.isPresent()) {
                Bar bar = next.get();
                decisionService.processBar(bar);
                lastProcessedId = bar.getId();
                next = barStore.findNextAfter(lastProcessedId);
            }
        } catch (RuntimeException e) {
            log.error("Decision poll failed: lastProcessedId={}, error={}", lastProcessedId, e.getMessage(), e);
        }
    }

    public Long getLastProcessedId() {
        return lastProcessedId;
    }
}

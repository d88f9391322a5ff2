package com.ibstrader.housekeeping;

import com.ibstrader.config.TradingConfig;
import com.ibstrader.store.BarStore;
import com.ibstrader.store.SignalStore;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Prunes bars and signals older than {@code ibstrader.housekeeping.retention} on the
 * {@code ibstrader.housekeeping.cron} schedule. Log files are rotated by Logback.
 */
@Service
@ConditionalOnProperty(name = "ibstrader.housekeeping.enabled", havingValue = "true", matchIfMissing = true)
public class HousekeepingService {

    private static final Logger log = LoggerFactory.getLogger(HousekeepingService.class);

    private final BarStore barStore;
    private final SignalStore signalStore;
    private final TradingConfig tradingConfig;

    public HousekeepingService(BarStore barStore, SignalStore signalStore, TradingConfig tradingConfig) {
        this.barStore = barStore;
        this.signalStore = signalStore;
        this.tradingConfig = tradingConfig;
    }

    @Scheduled(cron = "${ibstrader.housekeeping.cron:0 0 0 * * SUN}")
    public void scheduledPrune() {
        try {
            prune();
        } catch (RuntimeException e) {
            log.error("Housekeeping failed: {}", e.getMessage(), e);
        }
    }

    /** Deletes expired records and returns how many rows went in total. */
    public int prune() {
        Duration retention = tradingConfig.getHousekeeping().getRetention();
        Instant barCutoff = Instant.now().minus(retention);
        LocalDateTime signalCutoff = LocalDateTime.now().minus(retention);

        int bars = barStore.pruneOlderThan(barCutoff);
        int signals = signalStore.pruneOlderThan(signalCutoff);
        log.info("Housekeeping done: retention={}, barsDeleted={}, signalsDeleted={}", retention, bars, signals);
        return bars + signals;
    }
}

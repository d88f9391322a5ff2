package com.ibstrader.config;

import com.ibstrader.domain.enums.TradingMode;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Trading, execution and strategy tunables.
 *
 * <p>Binds to the {@code ibstrader.*} prefix in application.yml. Each of the three loops
 * (aggregation, decision, execution) has its own {@code enabled} flag so the same jar can
 * run them together or as separate processes against one database.
 */
@Configuration
@ConfigurationProperties(prefix = "ibstrader")
@Getter
@Setter
public class TradingConfig {

    /** LIVE signs and sends orders to the exchange; PAPER fills them against live mids in memory. */
    private TradingMode tradingMode = TradingMode.PAPER;

    /** The single traded instrument (exchange coin name). */
    private String symbol = "BTC";

    private Execution execution = new Execution();

    private Strategy strategy = new Strategy();

    private Aggregation aggregation = new Aggregation();

    private Housekeeping housekeeping = new Housekeeping();

    private Paper paper = new Paper();

    @Getter
    @Setter
    public static class Execution {

        private boolean enabled = true;

        /** Delay between two passes over the pending signals. */
        private Duration pollInterval = Duration.ofSeconds(10);

        /** Re-quotes allowed after the initial placement. */
        private int requoteCount = 5;

        private Duration requoteInterval = Duration.ofSeconds(5);

        /** Fraction of the margin-implied size actually ordered. */
        private BigDecimal safetyBuffer = new BigDecimal("0.98");

        /** Relative tolerance when a fill is inferred from the position change. */
        private BigDecimal fillTolerance = new BigDecimal("0.10");

        /** Leave signals created before this process started untouched. */
        private boolean ignoreSignalsBeforeStartup = true;
    }

    @Getter
    @Setter
    public static class Strategy {

        /** Runs the decision loop. */
        private boolean enabled = true;

        /** Coarse bar length, also the minimum holding time of a trade. */
        private Duration window = Duration.ofHours(1);

        private Duration pollInterval = Duration.ofSeconds(10);

        /** Open a long when the bar's IBS is strictly below this value. */
        private double entryThreshold = 0.2;

        private double leverageBase = 5;

        private double leverageExponent = 7;

        /** Upper bound applied after the leverage curve. */
        private int maxLeverage = 5;

        /** Rebuild the open-trade flag from the exchange and signal history on startup. */
        private boolean recoverStateOnStartup = true;
    }

    @Getter
    @Setter
    public static class Aggregation {

        /** Runs the candle stream and bar aggregator. */
        private boolean enabled = true;

        /** Candle interval subscribed on the stream. */
        private String sourceInterval = "1m";

        private Duration reconnectDelay = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Housekeeping {

        private boolean enabled = true;

        /** Weekly, Sunday 00:00 by default. */
        private String cron = "0 0 0 * * SUN";

        private Duration retention = Duration.ofDays(30);
    }

    @Getter
    @Setter
    public static class Paper {

        /** Starting margin of the in-memory account. */
        private BigDecimal initialBalance = new BigDecimal("10000");
    }
}

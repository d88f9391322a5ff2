package com.ibstrader.strategy;

import com.ibstrader.config.TradingConfig;
import com.ibstrader.domain.enums.SignalAction;
import com.ibstrader.domain.enums.TradeSide;
import com.ibstrader.domain.model.Bar;
import com.ibstrader.domain.model.Signal;
import com.ibstrader.exception.InvalidBarException;
import com.ibstrader.exchange.ExchangeGateway;
import com.ibstrader.exchange.GatewayResult;
import com.ibstrader.execution.SignalExecutionEngine;
import com.ibstrader.store.SignalStore;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * IBS mean-reversion rules applied to each finished bar.
 *
 * <ul>
 *   <li>Flat: if no open signal is pending once the execution engine has had a pass, and IBS is below the entry threshold, write an
 *       {@code open long} signal at the bar close with IBS-derived leverage.</li>
 *   <li>In a trade for at least one window: write a {@code close long} signal at the bar
 *       close and consume any still-pending open signal.</li>
 * </ul>
 * After writing a signal the execution engine is invoked right away.
 *
 * <p>The in-trade flag is rebuilt on startup by {@link #recoverState()} from the live
 * position and the latest open signal.
 */
@Service
public class DecisionService {

    private static final Logger log = LoggerFactory.getLogger(DecisionService.class);

    private final SignalStore signalStore;
    private final SignalExecutionEngine signalExecutionEngine;
    private final ExchangeGateway exchangeGateway;
    private final TradingConfig tradingConfig;
    private final TradeState tradeState = new TradeState();

    public DecisionService(
            SignalStore signalStore,
            SignalExecutionEngine signalExecutionEngine,
            ExchangeGateway exchangeGateway,
            TradingConfig tradingConfig) {
        this.signalStore = signalStore;
        this.signalExecutionEngine = signalExecutionEngine;
        this.exchangeGateway = exchangeGateway;
        this.tradingConfig = tradingConfig;
    }

    /** Applies the strategy to one bar. Invalid bars are logged and skipped. */
    public synchronized void processBar(Bar bar) {
        double ibs;
        Instant barTime;
        try {
            ibs = IbsCalculator.ibs(bar);
            barTime = parseTimestamp(bar.getTimestamp());
        } catch (InvalidBarException e) {
            log.warn("Skipping bar: {}", e.getMessage());
            return;
        }
        log.info("Bar {}: IBS={}, close={}, state={}", bar.getTimestamp(), String.format("%.4f", ibs), bar.getClose(), tradeState);

        TradingConfig.Strategy strategy = tradingConfig.getStrategy();
        String symbol = tradingConfig.getSymbol();

        if (!tradeState.isActive()) {
            if (signalStore.hasPendingOpen(symbol)) {
                signalExecutionEngine.runOnce();
                if (signalStore.hasPendingOpen(symbol)) {
                    log.info("Pending open signal exists, not opening another: symbol={}", symbol);
                    return;
                }
            }
            if (ibs >= strategy.getEntryThreshold()) {
                return;
            }
            int leverage = LeverageCalculator.leverage(
                    ibs, strategy.getLeverageBase(), strategy.getLeverageExponent(), strategy.getMaxLeverage());
            Signal open = signalStore.append(Signal.builder()
                    .timestamp(bar.getTimestamp())
                    .action(SignalAction.OPEN)
                    .symbol(symbol)
                    .side(TradeSide.LONG)
                    .price(bar.getClose())
                    .leverage(BigDecimal.valueOf(leverage))
                    .build());
            tradeState.open(barTime, leverage);
            log.info("Opened trade: signalId={}, ibs={}, leverage={}x, price={}",
                    open.getId(), String.format("%.4f", ibs), leverage, bar.getClose());
            signalExecutionEngine.runOnce();
            return;
        }

        Duration held = Duration.between(tradeState.getEntryTime(), barTime);
        if (held.compareTo(strategy.getWindow()) < 0) {
            return;
        }
        Signal close = signalStore.append(Signal.builder()
                .timestamp(bar.getTimestamp())
                .action(SignalAction.CLOSE)
                .symbol(symbol)
                .side(TradeSide.LONG)
                .price(bar.getClose())
                .build());
        signalStore.consumePendingOpens(symbol);
        log.info("Closed trade: signalId={}, held={}, price={}", close.getId(), held, bar.getClose());
        tradeState.reset();
        signalExecutionEngine.runOnce();
    }

    /**
     * Rebuilds the in-trade flag. A non-zero live position means a trade is open; its
     * entry time and leverage come from the latest open signal, or from now when there is
     * none. A flat or unreadable position leaves the state flat.
     */
    public synchronized void recoverState() {
        String symbol = tradingConfig.getSymbol();
        GatewayResult<BigDecimal> position = exchangeGateway.getPositionSize(symbol);
        if (position.isErr()) {
            log.warn("Position unavailable, starting flat: symbol={}, reason={}", symbol, position.getReason());
            tradeState.reset();
            return;
        }
        if (position.getValue().signum() == 0) {
            log.info("No live position, starting flat: symbol={}", symbol);
            tradeState.reset();
            return;
        }

        Optional<Signal> latestOpen = signalStore.findLatestOpen(symbol);
        Instant entryTime = Instant.now();
        int leverage = 1;
        if (latestOpen.isPresent()) {
            try {
                entryTime = parseTimestamp(latestOpen.get().getTimestamp());
            } catch (InvalidBarException e) {
                log.warn("Unreadable open signal timestamp, using now: {}", e.getMessage());
            }
            if (latestOpen.get().getLeverage() != null) {
                leverage = latestOpen.get().getLeverage().intValue();
            }
        }
        tradeState.open(entryTime, leverage);
        log.info("Recovered open trade: symbol={}, position={}, state={}", symbol, position.getValue(), tradeState);
    }

    public TradeState getTradeState() {
        return tradeState;
    }

    /** ISO-8601 with offset, or without offset read as UTC. */
    static Instant parseTimestamp(String timestamp) {
        if (timestamp == null) {
            throw new InvalidBarException("Missing timestamp");
        }
        try {
            return OffsetDateTime.parse(timestamp).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(timestamp).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException inner) {
                throw new InvalidBarException("Unparseable timestamp: " + timestamp);
            }
        }
    }
}

package com.ibstrader.execution;

import com.ibstrader.config.TradingConfig;
import com.ibstrader.domain.enums.TradeSide;
import com.ibstrader.domain.model.AccountState;
import com.ibstrader.domain.model.LimitOrderRequest;
import com.ibstrader.domain.model.Signal;
import com.ibstrader.exchange.ExchangeGateway;
import com.ibstrader.exchange.GatewayResult;
import com.ibstrader.observability.ExecutionMetrics;
import com.ibstrader.store.SignalStore;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives pending signals to a terminal state against the exchange.
 *
 * <p>A pass reads the pending signals in ascending id order and handles them one at a
 * time. Each signal ends executed or failed through the store's guarded transition, so a
 * signal is never acted on twice. A signal whose action is not recognized is logged and
 * left pending. Exceptions are contained per signal: the signal is marked failed and the
 * pass moves on to the next one.
 *
 * <p>When signals written before startup are ignored, the first pass marks the ones still
 * pending as failed, so a stale open never holds back new entries.
 *
 * <p>Passes are serialized. The decision loop calls {@link #runOnce()} right after
 * writing a signal and the polling loop calls it on its own schedule; whichever comes
 * second waits for the first to finish.
 */
@Service
public class SignalExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(SignalExecutionEngine.class);

    private final SignalStore signalStore;
    private final ExchangeGateway exchangeGateway;
    private final OrderChaser orderChaser;
    private final TradingConfig tradingConfig;
    private final ExecutionMetrics executionMetrics;
    private final ReentrantLock passLock = new ReentrantLock();
    private final LocalDateTime startedAt = LocalDateTime.now();
    private boolean staleSignalsExpired;

    public SignalExecutionEngine(
            SignalStore signalStore,
            ExchangeGateway exchangeGateway,
            OrderChaser orderChaser,
            TradingConfig tradingConfig,
            ExecutionMetrics executionMetrics) {
        this.signalStore = signalStore;
        this.exchangeGateway = exchangeGateway;
        this.orderChaser = orderChaser;
        this.tradingConfig = tradingConfig;
        this.executionMetrics = executionMetrics;
    }

    /**
     * Processes every pending signal once.
     *
     * @return the number of signals that reached a terminal state in this pass
     */
    public int runOnce() {
        passLock.lock();
        try {
            boolean ignoreBeforeStartup = tradingConfig.getExecution().isIgnoreSignalsBeforeStartup();
            if (ignoreBeforeStartup && !staleSignalsExpired) {
                expireStaleSignals();
            }
            List<Signal> pending = ignoreBeforeStartup
                    ? signalStore.fetchPendingSince(startedAt)
                    : signalStore.fetchPending();
            if (pending.isEmpty()) {
                log.debug("No pending signals");
                return 0;
            }
            log.info("Processing pending signals: count={}", pending.size());
            int completed = 0;
            for (Signal signal : pending) {
                if (process(signal)) {
                    completed++;
                }
            }
            return completed;
        } finally {
            passLock.unlock();
        }
    }

    private void expireStaleSignals() {
        List<Signal> expired = signalStore.failPendingBefore(startedAt);
        for (Signal signal : expired) {
            executionMetrics.recordSignalFailed();
            log.warn("Signal pending since before startup, marked failed: id={}, action={}, symbol={}, createdAt={}",
                    signal.getId(), signal.getRawAction(), signal.getSymbol(), signal.getCreatedAt());
        }
        staleSignalsExpired = true;
    }

    /** Returns true if the signal left the pending state. */
    private boolean process(Signal signal) {
        log.info("Processing signal: id={}, action={}, symbol={}, side={}, price={}, leverage={}",
                signal.getId(),
                signal.getRawAction(),
                signal.getSymbol(),
                signal.getSide(),
                signal.getPrice(),
                signal.getLeverage());
        try {
            switch (signal.getAction()) {
                case OPEN:
                    return complete(signal, handleOpen(signal));
                case CLOSE:
                    return complete(signal, handleClose(signal));
                default:
                    log.error("Unrecognized signal action, leaving pending: id={}, action='{}'",
                            signal.getId(), signal.getRawAction());
                    return false;
            }
        } catch (RuntimeException e) {
            log.error("Signal processing failed: id={}, error={}", signal.getId(), e.getMessage(), e);
            return complete(signal, false);
        }
    }

    private boolean handleOpen(Signal signal) {
        String symbol = symbolOf(signal);
        TradeSide side = signal.getSide();
        if (side == null) {
            log.error("Open signal without a valid side: id={}", signal.getId());
            return false;
        }
        BigDecimal leverage = signal.getLeverage() == null || signal.getLeverage().signum() <= 0
                ? BigDecimal.ONE
                : signal.getLeverage();

        GatewayResult<Void> leverageResult =
                exchangeGateway.setLeverage(symbol, leverage.setScale(0, RoundingMode.HALF_UP).max(BigDecimal.ONE).intValue());
        if (leverageResult.isErr()) {
            log.warn("Set leverage failed, continuing: id={}, reason={}", signal.getId(), leverageResult.getReason());
        }

        GatewayResult<AccountState> account = exchangeGateway.getAccountState();
        GatewayResult<BigDecimal> mid = exchangeGateway.getMidPrice(symbol);
        GatewayResult<Integer> decimals = exchangeGateway.getSizeDecimals(symbol);
        if (account.isErr() || mid.isErr() || decimals.isErr()) {
            log.error("Open signal inputs unavailable: id={}, account={}, mid={}, sizeDecimals={}",
                    signal.getId(), account, mid, decimals);
            return false;
        }

        BigDecimal size = TradeSizer.openSize(
                account.getValue().getWithdrawable(),
                leverage,
                mid.getValue(),
                tradingConfig.getExecution().getSafetyBuffer(),
                decimals.getValue());
        if (size.signum() <= 0) {
            log.error("Insufficient margin for open: id={}, withdrawable={}, leverage={}, mid={}",
                    signal.getId(), account.getValue().getWithdrawable(), leverage, mid.getValue());
            return false;
        }

        BigDecimal price = TradeSizer.limitPrice(mid.getValue());
        log.info("Opening position: id={}, symbol={}, side={}, size={}, price={}, leverage={}",
                signal.getId(), symbol, side, size, price, leverage);
        ChaseResult result = orderChaser.chase(LimitOrderRequest.builder()
                .symbol(symbol)
                .side(side)
                .size(size)
                .price(price)
                .reduceOnly(false)
                .build());
        return result.isSuccess();
    }

    private boolean handleClose(Signal signal) {
        String symbol = symbolOf(signal);
        GatewayResult<BigDecimal> position = exchangeGateway.getPositionSize(symbol);
        if (position.isErr()) {
            log.error("Position unavailable for close: id={}, reason={}", signal.getId(), position.getReason());
            return false;
        }
        if (position.getValue().signum() == 0) {
            log.info("No position to close, nothing to do: id={}, symbol={}", signal.getId(), symbol);
            return true;
        }

        GatewayResult<Integer> decimals = exchangeGateway.getSizeDecimals(symbol);
        GatewayResult<BigDecimal> mid = exchangeGateway.getMidPrice(symbol);
        if (decimals.isErr() || mid.isErr()) {
            log.error("Close signal inputs unavailable: id={}, mid={}, sizeDecimals={}", signal.getId(), mid, decimals);
            return false;
        }

        BigDecimal size = TradeSizer.closeSize(position.getValue(), decimals.getValue());
        if (size.signum() == 0) {
            log.info("Position below size precision, treating as flat: id={}, position={}",
                    signal.getId(), position.getValue());
            return true;
        }
        TradeSide side = position.getValue().signum() > 0 ? TradeSide.SHORT : TradeSide.LONG;
        BigDecimal price = TradeSizer.limitPrice(mid.getValue());
        log.info("Closing position: id={}, symbol={}, position={}, side={}, size={}, price={}",
                signal.getId(), symbol, position.getValue(), side, size, price);
        ChaseResult result = orderChaser.chase(LimitOrderRequest.builder()
                .symbol(symbol)
                .side(side)
                .size(size)
                .price(price)
                .reduceOnly(true)
                .build());
        return result.isSuccess();
    }

    private boolean complete(Signal signal, boolean success) {
        boolean transitioned = success ? signalStore.markExecuted(signal.getId()) : signalStore.markFailed(signal.getId());
        if (transitioned) {
            if (success) {
                executionMetrics.recordSignalExecuted();
            } else {
                executionMetrics.recordSignalFailed();
            }
            log.info("Signal {}: id={}", success ? "executed" : "failed", signal.getId());
        }
        return transitioned;
    }

    private String symbolOf(Signal signal) {
        return signal.getSymbol() != null ? signal.getSymbol() : tradingConfig.getSymbol();
    }
}

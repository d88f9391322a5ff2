package com.ibstrader.execution;

import com.ibstrader.config.TradingConfig;
import com.ibstrader.domain.enums.ChaseOutcome;
import com.ibstrader.domain.model.LimitOrderRequest;
import com.ibstrader.domain.model.OrderAck;
import com.ibstrader.domain.model.OrderRef;
import com.ibstrader.exchange.ExchangeGateway;
import com.ibstrader.exchange.GatewayResult;
import com.ibstrader.exchange.HyperliquidWire;
import com.ibstrader.observability.ExecutionMetrics;
import java.math.BigDecimal;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Places a GTC limit order and keeps it priced at the current mid until it fills or the
 * re-quote budget runs out.
 *
 * <pre>
 * PLACED --error--------------------------------> FAILED
 *        --filled in ack------------------------> FILLED
 *        --resting--> RESTING (poll, at most requoteCount + 1 times)
 *                       filled / in fill history -> FILLED
 *                       position moved by size ---> FILLED_FALLBACK
 *                       canceled, rejected, lost -> FAILED
 *                       open, budget left --------> modify to new mid (error -> FAILED)
 *                       open, budget spent -------> RESTING_EXHAUSTED
 * </pre>
 *
 * <p>Every placement carries a fresh client order id so that the order can be found in
 * the fill history even when the exchange has not returned or indexed its order id. An
 * interrupted wait ends the chase as {@link ChaseOutcome#RESTING_EXHAUSTED}: the order is
 * presumed live and is never sent again.
 */
@Service
public class OrderChaser {

    private static final Logger log = LoggerFactory.getLogger(OrderChaser.class);

    private final ExchangeGateway exchangeGateway;
    private final FillDetector fillDetector;
    private final TradingConfig tradingConfig;
    private final ExecutionMetrics executionMetrics;
    private final Sleeper sleeper;

    @Autowired
    public OrderChaser(
            ExchangeGateway exchangeGateway,
            FillDetector fillDetector,
            TradingConfig tradingConfig,
            ExecutionMetrics executionMetrics) {
        this(exchangeGateway, fillDetector, tradingConfig, executionMetrics, Sleeper.THREAD);
    }

    public OrderChaser(
            ExchangeGateway exchangeGateway,
            FillDetector fillDetector,
            TradingConfig tradingConfig,
            ExecutionMetrics executionMetrics,
            Sleeper sleeper) {
        this.exchangeGateway = exchangeGateway;
        this.fillDetector = fillDetector;
        this.tradingConfig = tradingConfig;
        this.executionMetrics = executionMetrics;
        this.sleeper = sleeper;
    }

    /**
     * Runs one chase to a terminal outcome.
     *
     * @param order symbol, side, size, initial price and reduce-only flag; any client order id is replaced
     */
    public ChaseResult chase(LimitOrderRequest order) {
        long startedAt = System.nanoTime();
        ChaseResult result = doChase(order);
        executionMetrics.recordChase(result.getOutcome(), Duration.ofNanos(System.nanoTime() - startedAt));
        log.info("Chase finished: symbol={}, side={}, size={}, outcome={}, requotes={}, ref={}, detail={}",
                order.getSymbol(),
                order.getSide(),
                order.getSize(),
                result.getOutcome(),
                result.getRequotes(),
                result.getOrderRef(),
                result.getDetail());
        return result;
    }

    private ChaseResult doChase(LimitOrderRequest order) {
        TradingConfig.Execution settings = tradingConfig.getExecution();

        GatewayResult<BigDecimal> pre = exchangeGateway.getPositionSize(order.getSymbol());
        BigDecimal prePosition = pre.isOk() ? pre.getValue() : null;
        if (prePosition == null) {
            log.warn("Pre-trade position unavailable, position fallback disabled: {}", pre.getReason());
        }

        LimitOrderRequest request = order.toBuilder().clientOrderId(HyperliquidWire.newClientOrderId()).build();
        GatewayResult<OrderAck> placed = exchangeGateway.placeLimitOrder(request);
        if (placed.isErr()) {
            return ChaseResult.failed(null, 0, "placement failed: " + placed.getReason());
        }
        OrderAck ack = placed.getValue();
        OrderRef ref = OrderRef.of(ack.getOrderId(), request.getClientOrderId());
        switch (ack.getStatus()) {
            case ERROR:
                return ChaseResult.failed(ref, 0, "placement rejected: " + ack.getError());
            case FILLED:
                return ChaseResult.of(ChaseOutcome.FILLED, ref, 0);
            default:
                break;
        }
        log.info("Order resting: ref={}, price={}, size={}", ref, request.getPrice(), request.getSize());

        int requotes = 0;
        int maxRequotes = settings.getRequoteCount();
        for (int poll = 0; poll <= maxRequotes; poll++) {
            try {
                sleeper.sleep(settings.getRequoteInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Chase interrupted, leaving order on the book: ref={}", ref);
                return ChaseResult.of(ChaseOutcome.RESTING_EXHAUSTED, ref, requotes);
            }

            FillCheck check = fillDetector.check(ref, request, prePosition);
            switch (check) {
                case FILLED:
                    return ChaseResult.of(ChaseOutcome.FILLED, ref, requotes);
                case FILLED_FALLBACK:
                    return ChaseResult.of(ChaseOutcome.FILLED_FALLBACK, ref, requotes);
                case CANCELED:
                    return ChaseResult.failed(ref, requotes, "order canceled on the exchange");
                case LOST:
                    return ChaseResult.failed(ref, requotes, "order not found and no fill evidence");
                default:
                    break;
            }

            if (poll == maxRequotes) {
                break;
            }

            GatewayResult<BigDecimal> mid = exchangeGateway.getMidPrice(request.getSymbol());
            if (mid.isErr()) {
                log.warn("Mid price unavailable, keeping current quote: ref={}, reason={}", ref, mid.getReason());
                continue;
            }
            BigDecimal newPrice = TradeSizer.limitPrice(mid.getValue());
            if (newPrice.compareTo(request.getPrice()) == 0) {
                log.debug("Quote already at mid: ref={}, price={}", ref, newPrice);
                continue;
            }

            request = request.toBuilder().price(newPrice).build();
            GatewayResult<OrderAck> modified = exchangeGateway.modifyOrder(ref, request);
            if (modified.isErr()) {
                return ChaseResult.failed(ref, requotes, "modify failed: " + modified.getReason());
            }
            OrderAck modifyAck = modified.getValue();
            if (modifyAck.getStatus() == OrderAck.Status.ERROR) {
                return ChaseResult.failed(ref, requotes, "modify rejected: " + modifyAck.getError());
            }
            requotes++;
            executionMetrics.recordRequote();
            if (modifyAck.getOrderId() != null) {
                ref = ref.withOrderId(modifyAck.getOrderId());
            }
            log.info("Order re-quoted: ref={}, price={}, requote={}/{}", ref, newPrice, requotes, maxRequotes);
            if (modifyAck.getStatus() == OrderAck.Status.FILLED) {
                return ChaseResult.of(ChaseOutcome.FILLED, ref, requotes);
            }
        }

        log.warn("Re-quote budget exhausted, order left resting: ref={}, requotes={}", ref, requotes);
        return ChaseResult.of(ChaseOutcome.RESTING_EXHAUSTED, ref, requotes);
    }
}

package com.ibstrader.execution;

import com.ibstrader.config.TradingConfig;
import com.ibstrader.domain.enums.ExchangeOrderStatus;
import com.ibstrader.domain.model.ExchangeFill;
import com.ibstrader.domain.model.LimitOrderRequest;
import com.ibstrader.domain.model.OpenOrder;
import com.ibstrader.domain.model.OrderRef;
import com.ibstrader.domain.model.OrderStatusReport;
import com.ibstrader.exchange.ExchangeGateway;
import com.ibstrader.exchange.GatewayResult;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Works out whether a resting order has filled.
 *
 * <p>The order-status lookup is asked first. When it fails or does not know the order
 * yet, the evidence is checked in this order:
 * <ol>
 *   <li>recent fills carrying the order's client order id or order id: {@link FillCheck#FILLED}</li>
 *   <li>position moved to within {@code fillTolerance * size} of the expected post-fill
 *       position: {@link FillCheck#FILLED_FALLBACK}</li>
 *   <li>the order is listed among open orders: {@link FillCheck#OPEN}</li>
 *   <li>none of the above: {@link FillCheck#LOST}</li>
 * </ol>
 * A lost order is never assumed filled.
 */
@Component
public class FillDetector {

    private static final Logger log = LoggerFactory.getLogger(FillDetector.class);

    private final ExchangeGateway exchangeGateway;
    private final TradingConfig tradingConfig;

    public FillDetector(ExchangeGateway exchangeGateway, TradingConfig tradingConfig) {
        this.exchangeGateway = exchangeGateway;
        this.tradingConfig = tradingConfig;
    }

    /**
     * @param prePosition signed position before the order was placed, or null if it could not be read
     */
    public FillCheck check(OrderRef ref, LimitOrderRequest request, BigDecimal prePosition) {
        GatewayResult<OrderStatusReport> status = exchangeGateway.getOrderStatus(ref);
        if (status.isOk() && status.getValue().getStatus() != ExchangeOrderStatus.UNKNOWN) {
            return switch (status.getValue().getStatus()) {
                case FILLED -> FillCheck.FILLED;
                case OPEN -> FillCheck.OPEN;
                default -> FillCheck.CANCELED;
            };
        }
        log.info("Order status unreliable, checking fallbacks: ref={}, reason={}",
                ref, status.isOk() ? "unknown order" : status.getReason());

        if (foundInFills(ref)) {
            log.info("Fill found in trade history: ref={}", ref);
            return FillCheck.FILLED;
        }
        if (positionMatchesFill(request, prePosition)) {
            return FillCheck.FILLED_FALLBACK;
        }
        if (foundInOpenOrders(ref)) {
            return FillCheck.OPEN;
        }
        log.warn("No evidence of fill or open order: ref={}", ref);
        return FillCheck.LOST;
    }

    private boolean foundInFills(OrderRef ref) {
        GatewayResult<List<ExchangeFill>> fills = exchangeGateway.listRecentFills();
        if (fills.isErr()) {
            log.warn("Fill history unavailable: {}", fills.getReason());
            return false;
        }
        return fills.getValue().stream().anyMatch(fill -> ref.matches(fill.getOrderId(), fill.getClientOrderId()));
    }

    /** Expected post-fill position is the pre-trade position moved by the order size in the order's direction. */
    boolean positionMatchesFill(LimitOrderRequest request, BigDecimal prePosition) {
        if (prePosition == null) {
            return false;
        }
        GatewayResult<BigDecimal> current = exchangeGateway.getPositionSize(request.getSymbol());
        if (current.isErr()) {
            log.warn("Position unavailable for fill fallback: {}", current.getReason());
            return false;
        }
        BigDecimal size = request.getSize();
        BigDecimal expected = request.getSide().isBuy() ? prePosition.add(size) : prePosition.subtract(size);
        BigDecimal tolerance = size.multiply(tradingConfig.getExecution().getFillTolerance());
        boolean matches = current.getValue().subtract(expected).abs().compareTo(tolerance) <= 0;
        log.info("Position fallback: pre={}, current={}, expected={}, tolerance={}, match={}",
                prePosition, current.getValue(), expected, tolerance, matches);
        return matches;
    }

    private boolean foundInOpenOrders(OrderRef ref) {
        GatewayResult<List<OpenOrder>> open = exchangeGateway.listOpenOrders();
        if (open.isErr()) {
            log.warn("Open orders unavailable: {}", open.getReason());
            return false;
        }
        return open.getValue().stream().anyMatch(order -> ref.matches(order.getOrderId(), order.getClientOrderId()));
    }
}

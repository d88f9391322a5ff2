package com.ibstrader.simulator;

import com.ibstrader.domain.enums.ExchangeOrderStatus;
import com.ibstrader.domain.enums.TradeSide;
import com.ibstrader.domain.model.ExchangeFill;
import com.ibstrader.domain.model.ExchangePosition;
import com.ibstrader.domain.model.LimitOrderRequest;
import com.ibstrader.domain.model.OpenOrder;
import com.ibstrader.domain.model.OrderRef;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory limit order book and single-account ledger for paper trading.
 *
 * <p>Fill logic, checked against the mid price on every {@link #match} call:
 * <ul>
 *   <li>BUY: fills when mid <= limit price (at the limit price)</li>
 *   <li>SELL: fills when mid >= limit price (at the limit price)</li>
 * </ul>
 * Reduce-only orders are clipped to the open position and canceled when there is nothing
 * left to reduce. Withdrawable margin is the balance plus realized PnL minus the margin
 * held by open positions at their leverage.
 *
 * <p>Not thread-safe; {@link PaperExchangeGateway} serializes access.
 */
public class PaperOrderBook {

    private static final Logger log = LoggerFactory.getLogger(PaperOrderBook.class);

    private static final int MAX_FILLS = 2000;

    private final Map<Long, PaperOrder> orders = new LinkedHashMap<>();
    private final Map<String, Holding> holdings = new LinkedHashMap<>();
    private final Map<String, Integer> leverages = new LinkedHashMap<>();
    private final List<ExchangeFill> fills = new ArrayList<>();
    private BigDecimal balance;
    private long nextOrderId = 1;

    public PaperOrderBook(BigDecimal initialBalance) {
        this.balance = initialBalance;
    }

    /** Adds an order and returns its id; call {@link #match} to see whether it crossed. */
    public long add(LimitOrderRequest request) {
        long orderId = nextOrderId++;
        orders.put(orderId, new PaperOrder(orderId, request));
        log.debug("Paper order added: oid={}, side={}, size={}, price={}",
                orderId, request.getSide(), request.getSize(), request.getPrice());
        return orderId;
    }

    public Optional<PaperOrder> find(OrderRef ref) {
        return orders.values().stream()
                .filter(order -> ref.matches(order.getOrderId(), order.getRequest().getClientOrderId()))
                .findFirst();
    }

    /** Re-prices an open order. Returns false if the order is unknown or no longer open. */
    public boolean reprice(OrderRef ref, BigDecimal price) {
        Optional<PaperOrder> order = find(ref);
        if (order.isEmpty() || order.get().getStatus() != ExchangeOrderStatus.OPEN) {
            return false;
        }
        PaperOrder existing = order.get();
        existing.setRequest(existing.getRequest().toBuilder().price(price).build());
        return true;
    }

    /** Fills every open order in {@code symbol} that the mid has crossed. */
    public void match(String symbol, BigDecimal mid) {
        for (PaperOrder order : orders.values()) {
            LimitOrderRequest request = order.getRequest();
            if (order.getStatus() != ExchangeOrderStatus.OPEN || !request.getSymbol().equalsIgnoreCase(symbol)) {
                continue;
            }
            boolean crossed = request.getSide().isBuy()
                    ? mid.compareTo(request.getPrice()) <= 0
                    : mid.compareTo(request.getPrice()) >= 0;
            if (crossed) {
                fill(order);
            }
        }
    }

    public void setLeverage(String symbol, int leverage) {
        leverages.put(symbol, leverage);
    }

    public BigDecimal positionSize(String symbol) {
        Holding holding = holdings.get(symbol);
        return holding == null ? BigDecimal.ZERO : holding.size;
    }

    public List<ExchangePosition> positions() {
        List<ExchangePosition> positions = new ArrayList<>();
        holdings.forEach((symbol, holding) -> {
            if (holding.size.signum() != 0) {
                positions.add(ExchangePosition.builder()
                        .symbol(symbol)
                        .size(holding.size)
                        .entryPrice(holding.entryPrice)
                        .build());
            }
        });
        return positions;
    }

    public BigDecimal withdrawable() {
        BigDecimal held = BigDecimal.ZERO;
        for (Map.Entry<String, Holding> entry : holdings.entrySet()) {
            Holding holding = entry.getValue();
            int leverage = leverages.getOrDefault(entry.getKey(), 1);
            held = held.add(holding.size.abs().multiply(holding.entryPrice).divide(BigDecimal.valueOf(leverage), MathContext.DECIMAL64));
        }
        return balance.subtract(held).max(BigDecimal.ZERO);
    }

    public List<OpenOrder> openOrders() {
        List<OpenOrder> open = new ArrayList<>();
        for (PaperOrder order : orders.values()) {
            if (order.getStatus() == ExchangeOrderStatus.OPEN) {
                LimitOrderRequest request = order.getRequest();
                open.add(OpenOrder.builder()
                        .orderId(order.getOrderId())
                        .clientOrderId(request.getClientOrderId())
                        .symbol(request.getSymbol())
                        .side(request.getSide())
                        .limitPrice(request.getPrice())
                        .size(request.getSize())
                        .build());
            }
        }
        return open;
    }

    public List<ExchangeFill> fills() {
        return List.copyOf(fills);
    }

    private void fill(PaperOrder order) {
        LimitOrderRequest request = order.getRequest();
        Holding holding = holdings.computeIfAbsent(request.getSymbol(), s -> new Holding());
        BigDecimal size = request.getSize();
        if (request.isReduceOnly()) {
            boolean reduces = holding.size.signum() != 0 && request.getSide().isBuy() == (holding.size.signum() < 0);
            if (!reduces) {
                order.setStatus(ExchangeOrderStatus.CANCELED);
                log.info("Paper reduce-only order canceled, nothing to reduce: oid={}", order.getOrderId());
                return;
            }
            size = size.min(holding.size.abs());
        }

        BigDecimal delta = request.getSide().isBuy() ? size : size.negate();
        applyFill(holding, delta, request.getPrice());
        order.setStatus(ExchangeOrderStatus.FILLED);
        order.setFilledSize(size);

        fills.add(ExchangeFill.builder()
                .orderId(order.getOrderId())
                .clientOrderId(request.getClientOrderId())
                .symbol(request.getSymbol())
                .side(request.getSide())
                .price(request.getPrice())
                .size(size)
                .time(Instant.now())
                .build());
        if (fills.size() > MAX_FILLS) {
            fills.remove(0);
        }
        log.info("Paper order filled: oid={}, side={}, size={}, price={}, position={}",
                order.getOrderId(), request.getSide(), size, request.getPrice(), holding.size);
    }

    private void applyFill(Holding holding, BigDecimal delta, BigDecimal price) {
        BigDecimal current = holding.size;
        if (current.signum() == 0 || current.signum() == delta.signum()) {
            BigDecimal newSize = current.add(delta);
            holding.entryPrice = current.abs().multiply(holding.entryPrice)
                    .add(delta.abs().multiply(price))
                    .divide(newSize.abs(), MathContext.DECIMAL64);
            holding.size = newSize;
            return;
        }
        BigDecimal closed = delta.abs().min(current.abs());
        BigDecimal pnlPerUnit = price.subtract(holding.entryPrice);
        BigDecimal realized = pnlPerUnit.multiply(closed).multiply(BigDecimal.valueOf(current.signum()));
        balance = balance.add(realized);
        BigDecimal newSize = current.add(delta);
        if (newSize.signum() != 0 && newSize.signum() != current.signum()) {
            holding.entryPrice = price;
        } else if (newSize.signum() == 0) {
            holding.entryPrice = BigDecimal.ZERO;
        }
        holding.size = newSize;
    }

    private static final class Holding {
        private BigDecimal size = BigDecimal.ZERO;
        private BigDecimal entryPrice = BigDecimal.ZERO;
    }
}

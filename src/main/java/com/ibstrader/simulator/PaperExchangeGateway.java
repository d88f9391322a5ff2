package com.ibstrader.simulator;

import com.ibstrader.config.TradingConfig;
import com.ibstrader.domain.model.AccountState;
import com.ibstrader.domain.model.ExchangeFill;
import com.ibstrader.domain.model.LimitOrderRequest;
import com.ibstrader.domain.model.OpenOrder;
import com.ibstrader.domain.model.OrderAck;
import com.ibstrader.domain.model.OrderRef;
import com.ibstrader.domain.model.OrderStatusReport;
import com.ibstrader.exception.ExchangeException;
import com.ibstrader.exchange.AssetDirectory;
import com.ibstrader.exchange.ExchangeGateway;
import com.ibstrader.exchange.GatewayResult;
import com.ibstrader.exchange.HyperliquidInfoService;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Paper-trading {@link ExchangeGateway}: real mid prices and instrument metadata from the
 * public info endpoint, orders and the account simulated by a {@link PaperOrderBook}.
 *
 * <p>Resting orders are matched lazily against a fresh mid each time the engine looks at
 * them (status, open orders, fills, position), which is how the chase loop observes fills.
 * Needs no credentials. Active unless {@code ibstrader.trading-mode=LIVE}.
 */
@Component
@ConditionalOnProperty(name = "ibstrader.trading-mode", havingValue = "PAPER", matchIfMissing = true)
public class PaperExchangeGateway implements ExchangeGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperExchangeGateway.class);

    private final HyperliquidInfoService infoService;
    private final AssetDirectory assetDirectory;
    private final PaperOrderBook book;
    private final String symbol;

    public PaperExchangeGateway(HyperliquidInfoService infoService, TradingConfig tradingConfig) {
        this.infoService = infoService;
        this.assetDirectory = new AssetDirectory(infoService);
        this.book = new PaperOrderBook(tradingConfig.getPaper().getInitialBalance());
        this.symbol = tradingConfig.getSymbol();
        log.info("Paper trading enabled: symbol={}, initialBalance={}",
                symbol, tradingConfig.getPaper().getInitialBalance());
    }

    @Override
    public GatewayResult<BigDecimal> getMidPrice(String coin) {
        return call("getMidPrice", () -> mid(coin));
    }

    @Override
    public GatewayResult<AccountState> getAccountState() {
        return call("getAccountState", () -> {
            synchronized (book) {
                matchQuietly();
                return AccountState.builder()
                        .withdrawable(book.withdrawable())
                        .positions(book.positions())
                        .build();
            }
        });
    }

    @Override
    public GatewayResult<BigDecimal> getPositionSize(String coin) {
        return call("getPositionSize", () -> {
            synchronized (book) {
                matchQuietly();
                return book.positionSize(coin);
            }
        });
    }

    @Override
    public GatewayResult<Integer> getSizeDecimals(String coin) {
        return call("getSizeDecimals", () -> assetDirectory.require(coin).sizeDecimals());
    }

    @Override
    public GatewayResult<Void> setLeverage(String coin, int leverage) {
        synchronized (book) {
            book.setLeverage(coin, leverage);
        }
        log.info("Paper leverage set: symbol={}, leverage={}x", coin, leverage);
        return GatewayResult.done();
    }

    @Override
    public GatewayResult<OrderAck> placeLimitOrder(LimitOrderRequest request) {
        return call("placeLimitOrder", () -> {
            BigDecimal mid = mid(request.getSymbol());
            synchronized (book) {
                long orderId = book.add(request);
                book.match(request.getSymbol(), mid);
                return ack(orderId);
            }
        });
    }

    @Override
    public GatewayResult<OrderAck> modifyOrder(OrderRef ref, LimitOrderRequest request) {
        return call("modifyOrder", () -> {
            BigDecimal mid = mid(request.getSymbol());
            synchronized (book) {
                if (!book.reprice(ref, request.getPrice())) {
                    return OrderAck.error("Cannot modify canceled or filled order");
                }
                book.match(request.getSymbol(), mid);
                return ack(book.find(ref).orElseThrow().getOrderId());
            }
        });
    }

    @Override
    public GatewayResult<OrderStatusReport> getOrderStatus(OrderRef ref) {
        return call("getOrderStatus", () -> {
            synchronized (book) {
                matchQuietly();
                Optional<PaperOrder> order = book.find(ref);
                if (order.isEmpty()) {
                    return OrderStatusReport.unknown();
                }
                return OrderStatusReport.builder()
                        .status(order.get().getStatus())
                        .orderId(order.get().getOrderId())
                        .clientOrderId(order.get().getRequest().getClientOrderId())
                        .build();
            }
        });
    }

    @Override
    public GatewayResult<List<OpenOrder>> listOpenOrders() {
        return call("listOpenOrders", () -> {
            synchronized (book) {
                matchQuietly();
                return book.openOrders();
            }
        });
    }

    @Override
    public GatewayResult<List<ExchangeFill>> listRecentFills() {
        return call("listRecentFills", () -> {
            synchronized (book) {
                matchQuietly();
                return book.fills();
            }
        });
    }

    private OrderAck ack(long orderId) {
        PaperOrder order = book.find(OrderRef.of(orderId, null)).orElseThrow();
        return switch (order.getStatus()) {
            case FILLED -> OrderAck.filled(orderId, order.getFilledSize(), order.getRequest().getPrice());
            case OPEN -> OrderAck.resting(orderId);
            default -> OrderAck.error("Order " + order.getStatus().name().toLowerCase());
        };
    }

    private BigDecimal mid(String coin) {
        BigDecimal mid = infoService.allMids().get(coin);
        if (mid == null) {
            throw ExchangeException.rejected("No mid price for " + coin);
        }
        return mid;
    }

    /** Matches the traded symbol's resting orders; a missing mid just defers matching. */
    private void matchQuietly() {
        try {
            book.match(symbol, mid(symbol));
        } catch (ExchangeException e) {
            log.debug("Paper matching deferred: {}", e.getMessage());
        }
    }

    private <T> GatewayResult<T> call(String operation, Supplier<T> body) {
        try {
            return GatewayResult.ok(body.get());
        } catch (ExchangeException e) {
            log.warn("Paper gateway call failed: operation={}, reason={}", operation, e.getMessage());
            return GatewayResult.err(e.getMessage(), e.isTransientFailure());
        } catch (RuntimeException e) {
            log.warn("Paper gateway call failed: operation={}, error={}", operation, e.toString());
            return GatewayResult.err(operation + " failed: " + e.getMessage(), true);
        }
    }
}

package com.ibstrader.exchange;

import com.ibstrader.domain.model.AccountState;
import com.ibstrader.domain.model.ExchangeFill;
import com.ibstrader.domain.model.LimitOrderRequest;
import com.ibstrader.domain.model.OpenOrder;
import com.ibstrader.domain.model.OrderAck;
import com.ibstrader.domain.model.OrderRef;
import com.ibstrader.domain.model.OrderStatusReport;
import com.ibstrader.exception.ConfigurationException;
import com.ibstrader.exception.ExchangeException;
import java.math.BigDecimal;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Live {@link ExchangeGateway} backed by the Hyperliquid REST API.
 *
 * <p>Delegates reads to {@link HyperliquidInfoService} and signed writes to
 * {@link HyperliquidOrderService}, and turns every exception they raise into a failed
 * {@link GatewayResult}. The perpetuals universe is fetched once and cached; a symbol's
 * asset index is its position in that list.
 *
 * <p>Active when {@code ibstrader.trading-mode=LIVE}.
 */
@Component
@ConditionalOnProperty(name = "ibstrader.trading-mode", havingValue = "LIVE")
public class HyperliquidExchangeGateway implements ExchangeGateway {

    private static final Logger log = LoggerFactory.getLogger(HyperliquidExchangeGateway.class);

    private final HyperliquidInfoService infoService;
    private final HyperliquidOrderService orderService;
    private final AssetDirectory assetDirectory;

    public HyperliquidExchangeGateway(HyperliquidInfoService infoService, HyperliquidOrderService orderService) {
        this.infoService = infoService;
        this.orderService = orderService;
        this.assetDirectory = new AssetDirectory(infoService);
    }

    @Override
    public GatewayResult<BigDecimal> getMidPrice(String symbol) {
        return call("getMidPrice", () -> {
            BigDecimal mid = infoService.allMids().get(symbol);
            if (mid == null) {
                throw ExchangeException.rejected("No mid price for " + symbol);
            }
            return mid;
        });
    }

    @Override
    public GatewayResult<AccountState> getAccountState() {
        return call("getAccountState", infoService::clearinghouseState);
    }

    @Override
    public GatewayResult<BigDecimal> getPositionSize(String symbol) {
        return call("getPositionSize", () -> infoService.clearinghouseState().positionSize(symbol));
    }

    @Override
    public GatewayResult<Integer> getSizeDecimals(String symbol) {
        return call("getSizeDecimals", () -> assetDirectory.require(symbol).sizeDecimals());
    }

    @Override
    public GatewayResult<Void> setLeverage(String symbol, int leverage) {
        return call("setLeverage", () -> {
            orderService.updateLeverage(assetDirectory.require(symbol).index(), leverage);
            return null;
        });
    }

    @Override
    public GatewayResult<OrderAck> placeLimitOrder(LimitOrderRequest request) {
        return call("placeLimitOrder", () -> orderService.placeOrder(
                assetDirectory.require(request.getSymbol()).index(), request));
    }

    /**
     * Addresses the order by client order id when there is one. A modify replaces the
     * order and its exchange id, but the client order id carries over, so later modifies
     * still reach the live order.
     */
    @Override
    public GatewayResult<OrderAck> modifyOrder(OrderRef ref, LimitOrderRequest request) {
        Object oid = ref.clientOrderId() != null ? ref.clientOrderId() : ref.orderId();
        return call("modifyOrder", () -> orderService.modifyOrder(
                oid, assetDirectory.require(request.getSymbol()).index(), request));
    }

    @Override
    public GatewayResult<OrderStatusReport> getOrderStatus(OrderRef ref) {
        return call("getOrderStatus", () -> infoService.orderStatus(ref));
    }

    @Override
    public GatewayResult<List<OpenOrder>> listOpenOrders() {
        return call("listOpenOrders", infoService::openOrders);
    }

    @Override
    public GatewayResult<List<ExchangeFill>> listRecentFills() {
        return call("listRecentFills", infoService::userFills);
    }

    private <T> GatewayResult<T> call(String operation, Supplier<T> body) {
        try {
            return GatewayResult.ok(body.get());
        } catch (ExchangeException e) {
            log.warn("Gateway call failed: operation={}, transient={}, reason={}",
                    operation, e.isTransientFailure(), e.getMessage());
            return GatewayResult.err(e.getMessage(), e.isTransientFailure());
        } catch (ConfigurationException e) {
            log.error("Gateway call failed: operation={}, configuration={}", operation, e.getMessage());
            return GatewayResult.err(e.getMessage(), false);
        } catch (RuntimeException e) {
            // open circuit, exhausted rate limit, unparseable payloads
            log.warn("Gateway call failed: operation={}, error={}", operation, e.toString());
            return GatewayResult.err(operation + " failed: " + e.getMessage(), true);
        }
    }
}

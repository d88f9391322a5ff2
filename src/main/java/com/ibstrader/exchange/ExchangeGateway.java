package com.ibstrader.exchange;

import com.ibstrader.domain.model.AccountState;
import com.ibstrader.domain.model.ExchangeFill;
import com.ibstrader.domain.model.LimitOrderRequest;
import com.ibstrader.domain.model.OpenOrder;
import com.ibstrader.domain.model.OrderAck;
import com.ibstrader.domain.model.OrderRef;
import com.ibstrader.domain.model.OrderStatusReport;
import java.math.BigDecimal;
import java.util.List;

/**
 * Capability surface over the exchange used by the execution engine and the decision
 * process.
 *
 * <p>Implementations never throw for remote failures; every call answers with a
 * {@link GatewayResult}. A placement or modification that the exchange refused comes back
 * as an ok result carrying an {@link OrderAck.Status#ERROR} ack only when the exchange
 * answered per order; a whole-request rejection is an err result.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link com.ibstrader.exchange.HyperliquidExchangeGateway}: live trading</li>
 *   <li>{@link com.ibstrader.simulator.PaperExchangeGateway}: in-memory fills against live mids</li>
 * </ul>
 */
public interface ExchangeGateway {

    GatewayResult<BigDecimal> getMidPrice(String symbol);

    GatewayResult<AccountState> getAccountState();

    /** Signed position size in {@code symbol}; zero when flat. */
    GatewayResult<BigDecimal> getPositionSize(String symbol);

    /** Number of decimal places allowed in order sizes for {@code symbol}. */
    GatewayResult<Integer> getSizeDecimals(String symbol);

    GatewayResult<Void> setLeverage(String symbol, int leverage);

    GatewayResult<OrderAck> placeLimitOrder(LimitOrderRequest request);

    /** Re-prices the referenced order; the request carries the full new order. */
    GatewayResult<OrderAck> modifyOrder(OrderRef ref, LimitOrderRequest request);

    GatewayResult<OrderStatusReport> getOrderStatus(OrderRef ref);

    GatewayResult<List<OpenOrder>> listOpenOrders();

    GatewayResult<List<ExchangeFill>> listRecentFills();
}

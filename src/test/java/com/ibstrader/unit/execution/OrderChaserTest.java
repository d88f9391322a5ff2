package com.ibstrader.unit.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ibstrader.config.TradingConfig;
import com.ibstrader.domain.enums.ChaseOutcome;
import com.ibstrader.domain.enums.ExchangeOrderStatus;
import com.ibstrader.domain.enums.TradeSide;
import com.ibstrader.domain.model.ExchangeFill;
import com.ibstrader.domain.model.LimitOrderRequest;
import com.ibstrader.domain.model.OpenOrder;
import com.ibstrader.domain.model.OrderAck;
import com.ibstrader.domain.model.OrderRef;
import com.ibstrader.domain.model.OrderStatusReport;
import com.ibstrader.exchange.ExchangeGateway;
import com.ibstrader.exchange.GatewayResult;
import com.ibstrader.execution.ChaseResult;
import com.ibstrader.execution.FillDetector;
import com.ibstrader.execution.OrderChaser;
import com.ibstrader.observability.ExecutionMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for the chase loop: placement outcomes, polling with re-quotes, the fill
 * detection fallbacks and budget exhaustion. Waits are replaced by a no-op sleeper.
 */
class OrderChaserTest {

    private ExchangeGateway exchangeGateway;
    private TradingConfig tradingConfig;
    private SimpleMeterRegistry meterRegistry;
    private OrderChaser orderChaser;

    @BeforeEach
    void setUp() {
        exchangeGateway = mock(ExchangeGateway.class);
        tradingConfig = new TradingConfig();
        meterRegistry = new SimpleMeterRegistry();
        FillDetector fillDetector = new FillDetector(exchangeGateway, tradingConfig);
        orderChaser = new OrderChaser(
                exchangeGateway, fillDetector, tradingConfig, new ExecutionMetrics(meterRegistry), duration -> {});

        when(exchangeGateway.getPositionSize("BTC")).thenReturn(GatewayResult.ok(BigDecimal.ZERO));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private LimitOrderRequest longOrder() {
        return LimitOrderRequest.builder()
                .symbol("BTC")
                .side(TradeSide.LONG)
                .size(new BigDecimal("0.01"))
                .price(new BigDecimal("50000"))
                .reduceOnly(false)
                .build();
    }

    private void resting(long orderId) {
        when(exchangeGateway.placeLimitOrder(any())).thenReturn(GatewayResult.ok(OrderAck.resting(orderId)));
    }

    private void status(ExchangeOrderStatus status) {
        when(exchangeGateway.getOrderStatus(any()))
                .thenReturn(GatewayResult.ok(OrderStatusReport.builder().status(status).orderId(42L).build()));
    }

    @Nested
    @DisplayName("Placement")
    class Placement {

        @Test
        @DisplayName("Immediate fill in the acknowledgement ends FILLED without polling")
        void immediateFill() {
            when(exchangeGateway.placeLimitOrder(any()))
                    .thenReturn(GatewayResult.ok(
                            OrderAck.filled(42L, new BigDecimal("0.01"), new BigDecimal("50000"))));

            ChaseResult result = orderChaser.chase(longOrder());

            assertThat(result.getOutcome()).isEqualTo(ChaseOutcome.FILLED);
            verify(exchangeGateway, never()).getOrderStatus(any());
        }

        @Test
        @DisplayName("Placement error ends FAILED")
        void placementError() {
            when(exchangeGateway.placeLimitOrder(any())).thenReturn(GatewayResult.err("timeout", true));

            ChaseResult result = orderChaser.chase(longOrder());

            assertThat(result.getOutcome()).isEqualTo(ChaseOutcome.FAILED);
            assertThat(result.getOrderRef()).isNull();
            assertThat(result.getDetail()).contains("timeout");
        }

        @Test
        @DisplayName("Per-order rejection ends FAILED")
        void placementRejected() {
            when(exchangeGateway.placeLimitOrder(any()))
                    .thenReturn(GatewayResult.ok(OrderAck.error("Insufficient margin")));

            ChaseResult result = orderChaser.chase(longOrder());

            assertThat(result.getOutcome()).isEqualTo(ChaseOutcome.FAILED);
            assertThat(result.getDetail()).contains("Insufficient margin");
        }

        @Test
        @DisplayName("Each placement carries a fresh 128-bit client order id")
        void freshClientOrderId() {
            resting(42L);
            status(ExchangeOrderStatus.FILLED);

            orderChaser.chase(longOrder());
            orderChaser.chase(longOrder());

            ArgumentCaptor<LimitOrderRequest> captor = ArgumentCaptor.forClass(LimitOrderRequest.class);
            verify(exchangeGateway, times(2)).placeLimitOrder(captor.capture());
            List<LimitOrderRequest> sent = captor.getAllValues();
            assertThat(sent.get(0).getClientOrderId()).matches("0x[0-9a-f]{32}");
            assertThat(sent.get(0).getClientOrderId()).isNotEqualTo(sent.get(1).getClientOrderId());
        }
    }

    @Nested
    @DisplayName("Resting")
    class Resting {

        @Test
        @DisplayName("Status FILLED on first poll ends FILLED")
        void filledOnPoll() {
            resting(42L);
            status(ExchangeOrderStatus.FILLED);

            ChaseResult result = orderChaser.chase(longOrder());

            assertThat(result.getOutcome()).isEqualTo(ChaseOutcome.FILLED);
            assertThat(result.getOrderRef().orderId()).isEqualTo(42L);
            verify(exchangeGateway, never()).modifyOrder(any(), any());
        }

        @Test
        @DisplayName("External cancel ends FAILED and is not retried")
        void canceled() {
            resting(42L);
            status(ExchangeOrderStatus.CANCELED);

            ChaseResult result = orderChaser.chase(longOrder());

            assertThat(result.getOutcome()).isEqualTo(ChaseOutcome.FAILED);
            verify(exchangeGateway, times(1)).placeLimitOrder(any());
        }

        @Test
        @DisplayName("Open order is re-quoted to the rounded mid until the budget is exhausted")
        void exhaustsBudget() {
            resting(42L);
            status(ExchangeOrderStatus.OPEN);
            when(exchangeGateway.getMidPrice("BTC")).thenReturn(
                    GatewayResult.ok(new BigDecimal("50010.4")),
                    GatewayResult.ok(new BigDecimal("50020.6")),
                    GatewayResult.ok(new BigDecimal("50030")),
                    GatewayResult.ok(new BigDecimal("50040")),
                    GatewayResult.ok(new BigDecimal("50050")));
            when(exchangeGateway.modifyOrder(any(), any())).thenReturn(GatewayResult.ok(OrderAck.resting(42L)));

            ChaseResult result = orderChaser.chase(longOrder());

            assertThat(result.getOutcome()).isEqualTo(ChaseOutcome.RESTING_EXHAUSTED);
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getRequotes()).isEqualTo(5);
            verify(exchangeGateway, times(6)).getOrderStatus(any());

            ArgumentCaptor<LimitOrderRequest> captor = ArgumentCaptor.forClass(LimitOrderRequest.class);
            verify(exchangeGateway, times(5)).modifyOrder(any(), captor.capture());
            assertThat(captor.getAllValues().get(0).getPrice()).isEqualByComparingTo("50010");
            assertThat(captor.getAllValues().get(1).getPrice()).isEqualByComparingTo("50021");
            assertThat(captor.getAllValues().get(0).isReduceOnly()).isFalse();
            assertThat(meterRegistry.counter("orders.requoted").count()).isEqualTo(5.0);
        }

        @Test
        @DisplayName("Re-quote keeps the client order id and tracks a new order id")
        void requoteKeepsClientOrderId() {
            resting(42L);
            when(exchangeGateway.getOrderStatus(any())).thenReturn(
                    GatewayResult.ok(OrderStatusReport.builder().status(ExchangeOrderStatus.OPEN).build()),
                    GatewayResult.ok(OrderStatusReport.builder().status(ExchangeOrderStatus.FILLED).build()));
            when(exchangeGateway.getMidPrice("BTC")).thenReturn(GatewayResult.ok(new BigDecimal("50100")));
            when(exchangeGateway.modifyOrder(any(), any())).thenReturn(GatewayResult.ok(OrderAck.resting(43L)));

            ChaseResult result = orderChaser.chase(longOrder());

            ArgumentCaptor<LimitOrderRequest> placed = ArgumentCaptor.forClass(LimitOrderRequest.class);
            verify(exchangeGateway).placeLimitOrder(placed.capture());
            ArgumentCaptor<OrderRef> modifiedRef = ArgumentCaptor.forClass(OrderRef.class);
            verify(exchangeGateway).modifyOrder(modifiedRef.capture(), any());

            assertThat(result.getOutcome()).isEqualTo(ChaseOutcome.FILLED);
            assertThat(result.getOrderRef().orderId()).isEqualTo(43L);
            assertThat(result.getOrderRef().clientOrderId()).isEqualTo(placed.getValue().getClientOrderId());
            assertThat(modifiedRef.getValue().orderId()).isEqualTo(42L);
        }

        @Test
        @DisplayName("Consecutive re-quotes with id-less modify replies all address the same client order id")
        void consecutiveRequotesWithoutNewOrderId() {
            resting(42L);
            when(exchangeGateway.getOrderStatus(any())).thenReturn(
                    GatewayResult.ok(OrderStatusReport.builder().status(ExchangeOrderStatus.OPEN).build()),
                    GatewayResult.ok(OrderStatusReport.builder().status(ExchangeOrderStatus.OPEN).build()),
                    GatewayResult.ok(OrderStatusReport.builder().status(ExchangeOrderStatus.FILLED).build()));
            when(exchangeGateway.getMidPrice("BTC")).thenReturn(
                    GatewayResult.ok(new BigDecimal("50100")),
                    GatewayResult.ok(new BigDecimal("50200")));
            when(exchangeGateway.modifyOrder(any(), any())).thenReturn(GatewayResult.ok(OrderAck.resting(null)));

            ChaseResult result = orderChaser.chase(longOrder());

            ArgumentCaptor<LimitOrderRequest> placed = ArgumentCaptor.forClass(LimitOrderRequest.class);
            verify(exchangeGateway).placeLimitOrder(placed.capture());
            ArgumentCaptor<OrderRef> modifiedRef = ArgumentCaptor.forClass(OrderRef.class);
            ArgumentCaptor<LimitOrderRequest> modified = ArgumentCaptor.forClass(LimitOrderRequest.class);
            verify(exchangeGateway, times(2)).modifyOrder(modifiedRef.capture(), modified.capture());

            String clientOrderId = placed.getValue().getClientOrderId();
            assertThat(result.getOutcome()).isEqualTo(ChaseOutcome.FILLED);
            assertThat(result.getRequotes()).isEqualTo(2);
            assertThat(modifiedRef.getAllValues())
                    .extracting(OrderRef::clientOrderId)
                    .containsExactly(clientOrderId, clientOrderId);
            assertThat(modified.getAllValues())
                    .extracting(LimitOrderRequest::getClientOrderId)
                    .containsExactly(clientOrderId, clientOrderId);
            assertThat(modified.getAllValues().get(1).getPrice()).isEqualByComparingTo("50200");
        }

        @Test
        @DisplayName("No modify is sent when the rounded mid equals the resting price")
        void skipsModifyAtSamePrice() {
            resting(42L);
            status(ExchangeOrderStatus.OPEN);
            when(exchangeGateway.getMidPrice("BTC")).thenReturn(GatewayResult.ok(new BigDecimal("50000.2")));

            ChaseResult result = orderChaser.chase(longOrder());

            assertThat(result.getOutcome()).isEqualTo(ChaseOutcome.RESTING_EXHAUSTED);
            assertThat(result.getRequotes()).isZero();
            verify(exchangeGateway, never()).modifyOrder(any(), any());
        }

        @Test
        @DisplayName("Modify error ends FAILED")
        void modifyError() {
            resting(42L);
            status(ExchangeOrderStatus.OPEN);
            when(exchangeGateway.getMidPrice("BTC")).thenReturn(GatewayResult.ok(new BigDecimal("50100")));
            when(exchangeGateway.modifyOrder(any(), any())).thenReturn(GatewayResult.err("refused", false));

            ChaseResult result = orderChaser.chase(longOrder());

            assertThat(result.getOutcome()).isEqualTo(ChaseOutcome.FAILED);
            assertThat(result.getDetail()).contains("modify failed");
        }

        @Test
        @DisplayName("Interrupted wait leaves the order resting and never re-sends")
        void interrupted() {
            FillDetector fillDetector = new FillDetector(exchangeGateway, tradingConfig);
            OrderChaser interruptedChaser = new OrderChaser(
                    exchangeGateway,
                    fillDetector,
                    tradingConfig,
                    new ExecutionMetrics(meterRegistry),
                    duration -> {
                        throw new InterruptedException("shutdown");
                    });
            resting(42L);

            ChaseResult result = interruptedChaser.chase(longOrder());

            assertThat(result.getOutcome()).isEqualTo(ChaseOutcome.RESTING_EXHAUSTED);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
            verify(exchangeGateway, times(1)).placeLimitOrder(any());
            verify(exchangeGateway, never()).getOrderStatus(any());
        }
    }

    @Nested
    @DisplayName("Unreliable status")
    class UnreliableStatus {

        @Test
        @DisplayName("Position moving 0 -> 0.0098 for a 0.01 long ends FILLED_FALLBACK")
        void positionFallback() {
            resting(42L);
            when(exchangeGateway.getOrderStatus(any())).thenReturn(GatewayResult.err("timeout", true));
            when(exchangeGateway.listRecentFills()).thenReturn(GatewayResult.ok(List.of()));
            when(exchangeGateway.getPositionSize("BTC")).thenReturn(
                    GatewayResult.ok(BigDecimal.ZERO), GatewayResult.ok(new BigDecimal("0.0098")));

            ChaseResult result = orderChaser.chase(longOrder());

            assertThat(result.getOutcome()).isEqualTo(ChaseOutcome.FILLED_FALLBACK);
            assertThat(result.isSuccess()).isTrue();
        }

        @Test
        @DisplayName("Fill history entry for the order ends FILLED")
        void fillHistory() {
            resting(42L);
            status(ExchangeOrderStatus.UNKNOWN);
            when(exchangeGateway.listRecentFills()).thenReturn(GatewayResult.ok(List.of(ExchangeFill.builder()
                    .orderId(42L)
                    .symbol("BTC")
                    .side(TradeSide.LONG)
                    .size(new BigDecimal("0.01"))
                    .price(new BigDecimal("50000"))
                    .build())));

            ChaseResult result = orderChaser.chase(longOrder());

            assertThat(result.getOutcome()).isEqualTo(ChaseOutcome.FILLED);
        }

        @Test
        @DisplayName("Order still on the book is treated as resting")
        void stillOpen() {
            resting(42L);
            when(exchangeGateway.getOrderStatus(any())).thenReturn(GatewayResult.err("timeout", true));
            when(exchangeGateway.listRecentFills()).thenReturn(GatewayResult.ok(List.of()));
            when(exchangeGateway.listOpenOrders()).thenReturn(GatewayResult.ok(List.of(OpenOrder.builder()
                    .orderId(42L)
                    .symbol("BTC")
                    .side(TradeSide.LONG)
                    .limitPrice(new BigDecimal("50000"))
                    .size(new BigDecimal("0.01"))
                    .build())));
            when(exchangeGateway.getMidPrice("BTC")).thenReturn(GatewayResult.ok(new BigDecimal("50000")));

            ChaseResult result = orderChaser.chase(longOrder());

            assertThat(result.getOutcome()).isEqualTo(ChaseOutcome.RESTING_EXHAUSTED);
        }

        @Test
        @DisplayName("No evidence of fill or open order ends FAILED, never assumed filled")
        void lostOrder() {
            resting(42L);
            when(exchangeGateway.getOrderStatus(any())).thenReturn(GatewayResult.err("timeout", true));
            when(exchangeGateway.listRecentFills()).thenReturn(GatewayResult.ok(List.of()));
            when(exchangeGateway.listOpenOrders()).thenReturn(GatewayResult.ok(List.of()));

            ChaseResult result = orderChaser.chase(longOrder());

            assertThat(result.getOutcome()).isEqualTo(ChaseOutcome.FAILED);
            verify(exchangeGateway, never()).modifyOrder(any(), any());
            verify(exchangeGateway, times(1)).placeLimitOrder(any());
        }

        @Test
        @DisplayName("Without a pre-trade position the position fallback is skipped")
        void noPrePosition() {
            when(exchangeGateway.getPositionSize(eq("BTC"))).thenReturn(GatewayResult.err("down", true));
            resting(42L);
            when(exchangeGateway.getOrderStatus(any())).thenReturn(GatewayResult.err("timeout", true));
            when(exchangeGateway.listRecentFills()).thenReturn(GatewayResult.err("down", true));
            when(exchangeGateway.listOpenOrders()).thenReturn(GatewayResult.err("down", true));

            ChaseResult result = orderChaser.chase(longOrder());

            assertThat(result.getOutcome()).isEqualTo(ChaseOutcome.FAILED);
        }
    }
}

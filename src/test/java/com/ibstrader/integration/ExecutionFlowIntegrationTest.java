package com.ibstrader.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ibstrader.config.TradingConfig;
import com.ibstrader.domain.enums.ExecutionStatus;
import com.ibstrader.domain.enums.SignalAction;
import com.ibstrader.domain.enums.TradeSide;
import com.ibstrader.domain.model.Signal;
import com.ibstrader.exchange.AssetMeta;
import com.ibstrader.exchange.HyperliquidInfoService;
import com.ibstrader.execution.FillDetector;
import com.ibstrader.execution.OrderChaser;
import com.ibstrader.execution.SignalExecutionEngine;
import com.ibstrader.observability.ExecutionMetrics;
import com.ibstrader.simulator.PaperExchangeGateway;
import com.ibstrader.store.SignalStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * End-to-end execution flow on H2 and the paper exchange: signals written to the store are
 * sized, chased, filled against the mid price and marked terminal exactly once.
 * Only the public info endpoint is mocked.
 */
@DataJpaTest
@ActiveProfiles("test")
@Import(SignalStore.class)
class ExecutionFlowIntegrationTest {

    @Autowired
    private SignalStore signalStore;

    private HyperliquidInfoService infoService;
    private PaperExchangeGateway gateway;
    private SignalExecutionEngine engine;

    @BeforeEach
    void setUp() {
        infoService = mock(HyperliquidInfoService.class);
        when(infoService.allMids()).thenReturn(Map.of("BTC", new BigDecimal("50000")));
        when(infoService.meta()).thenReturn(List.of(new AssetMeta("BTC", 0, 5, 50)));

        TradingConfig tradingConfig = new TradingConfig();
        tradingConfig.getExecution().setIgnoreSignalsBeforeStartup(false);
        ExecutionMetrics metrics = new ExecutionMetrics(new SimpleMeterRegistry());

        gateway = new PaperExchangeGateway(infoService, tradingConfig);
        FillDetector fillDetector = new FillDetector(gateway, tradingConfig);
        OrderChaser orderChaser = new OrderChaser(gateway, fillDetector, tradingConfig, metrics, duration -> {});
        engine = new SignalExecutionEngine(signalStore, gateway, orderChaser, tradingConfig, metrics);
    }

    private Signal append(SignalAction action, String leverage) {
        return signalStore.append(Signal.builder()
                .timestamp("2024-01-01T10:00:00Z")
                .action(action)
                .symbol("BTC")
                .side(TradeSide.LONG)
                .price(new BigDecimal("50000"))
                .leverage(leverage == null ? null : new BigDecimal(leverage))
                .build());
    }

    private ExecutionStatus statusOf(Signal signal) {
        return signalStore.findById(signal.getId()).orElseThrow().getExecutionStatus();
    }

    @Test
    @DisplayName("Open then close round trip leaves the account flat and both signals executed")
    void openThenClose() {
        Signal open = append(SignalAction.OPEN, "2");

        assertThat(engine.runOnce()).isEqualTo(1);
        assertThat(statusOf(open)).isEqualTo(ExecutionStatus.EXECUTED);
        // 10000 * 2 / 50000 * 0.98
        assertThat(gateway.getPositionSize("BTC").getValue()).isEqualByComparingTo("0.392");

        Signal close = append(SignalAction.CLOSE, null);

        assertThat(engine.runOnce()).isEqualTo(1);
        assertThat(statusOf(close)).isEqualTo(ExecutionStatus.EXECUTED);
        assertThat(gateway.getPositionSize("BTC").getValue()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("A second pass does not act on terminal signals again")
    void idempotentPasses() {
        append(SignalAction.OPEN, "1");

        engine.runOnce();
        int secondPass = engine.runOnce();

        assertThat(secondPass).isZero();
        assertThat(gateway.listRecentFills().getValue()).hasSize(1);
    }

    @Test
    @DisplayName("Close without a position is executed without trading")
    void closeWhenFlat() {
        Signal close = append(SignalAction.CLOSE, null);

        engine.runOnce();

        assertThat(statusOf(close)).isEqualTo(ExecutionStatus.EXECUTED);
        assertThat(gateway.listRecentFills().getValue()).isEmpty();
    }

    @Test
    @DisplayName("Signals are handled in arrival order within one pass")
    void arrivalOrder() {
        Signal open = append(SignalAction.OPEN, "1");
        Signal close = append(SignalAction.CLOSE, null);

        assertThat(engine.runOnce()).isEqualTo(2);

        assertThat(statusOf(open)).isEqualTo(ExecutionStatus.EXECUTED);
        assertThat(statusOf(close)).isEqualTo(ExecutionStatus.EXECUTED);
        assertThat(gateway.listRecentFills().getValue())
                .extracting(fill -> fill.getSide())
                .containsExactly(TradeSide.LONG, TradeSide.SHORT);
        assertThat(gateway.getPositionSize("BTC").getValue()).isEqualByComparingTo("0");
    }
}

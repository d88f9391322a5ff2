package com.ibstrader.marketdata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ibstrader.config.ExchangeConfig;
import com.ibstrader.config.TradingConfig;
import com.ibstrader.domain.model.MinuteBar;
import com.ibstrader.exception.InvalidBarException;
import jakarta.annotation.PreDestroy;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Subscribes to the exchange's candle stream for the traded symbol and feeds closed
 * candles into the {@link BarAggregator}.
 *
 * <p>Started once the application is ready. On close or error the socket is reopened
 * after {@code ibstrader.aggregation.reconnect-delay}; the in-progress aggregate bar is
 * dropped on reconnect because minutes may have been missed. A ping keeps the idle
 * connection open. Enabled by {@code ibstrader.aggregation.enabled}.
 */
@Component
@ConditionalOnProperty(name = "ibstrader.aggregation.enabled", havingValue = "true", matchIfMissing = true)
public class HyperliquidCandleStream {

    private static final Logger log = LoggerFactory.getLogger(HyperliquidCandleStream.class);

    private static final long PING_INTERVAL_SECONDS = 50;

    private final ExchangeConfig exchangeConfig;
    private final TradingConfig tradingConfig;
    private final CandleMessageParser candleMessageParser;
    private final BarAggregator barAggregator;
    private final ObjectMapper objectMapper;
    private final ClosedCandleFilter closedCandleFilter = new ClosedCandleFilter();
    private final HttpClient httpClient = HttpClient.newHttpClient();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "candle-stream");
        t.setDaemon(true);
        return t;
    });

    private volatile WebSocket webSocket;
    private volatile boolean stopping;

    public HyperliquidCandleStream(
            ExchangeConfig exchangeConfig,
            TradingConfig tradingConfig,
            CandleMessageParser candleMessageParser,
            BarAggregator barAggregator,
            ObjectMapper objectMapper) {
        this.exchangeConfig = exchangeConfig;
        this.tradingConfig = tradingConfig;
        this.candleMessageParser = candleMessageParser;
        this.barAggregator = barAggregator;
        this.objectMapper = objectMapper;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        connect();
        scheduler.scheduleAtFixedRate(this::ping, PING_INTERVAL_SECONDS, PING_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    /** Handles one complete text message from the socket. */
    public void onMessage(String message) {
        Optional<MinuteBar> update;
        try {
            update = candleMessageParser.parse(message);
        } catch (InvalidBarException e) {
            log.warn("Skipping stream message: {}", e.getMessage());
            return;
        }
        update.flatMap(closedCandleFilter::offer).ifPresent(barAggregator::onMinuteBar);
    }

    private void connect() {
        if (stopping) {
            return;
        }
        String url = exchangeConfig.getWsUrl();
        log.info("Candle stream connecting: url={}, symbol={}", url, tradingConfig.getSymbol());
        httpClient.newWebSocketBuilder()
                .buildAsync(URI.create(url), new CandleListener())
                .whenComplete((ws, ex) -> {
                    if (ex != null) {
                        log.error("Candle stream connect failed: {}", ex.getMessage());
                        scheduleReconnect();
                    } else {
                        webSocket = ws;
                        subscribe(ws);
                    }
                });
    }

    private void subscribe(WebSocket ws) {
        Map<String, Object> subscription = new LinkedHashMap<>();
        subscription.put("type", "candle");
        subscription.put("coin", tradingConfig.getSymbol());
        subscription.put("interval", tradingConfig.getAggregation().getSourceInterval());
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("method", "subscribe");
        request.put("subscription", subscription);
        String text = toJson(request);
        ws.sendText(text, true);
        log.info("Candle stream subscribed: {}", text);
    }

    private void ping() {
        WebSocket ws = webSocket;
        if (ws != null && !ws.isOutputClosed()) {
            ws.sendText("{\"method\":\"ping\"}", true);
        }
    }

    private void scheduleReconnect() {
        webSocket = null;
        if (stopping) {
            return;
        }
        closedCandleFilter.reset();
        barAggregator.discardInProgress();
        long delay = tradingConfig.getAggregation().getReconnectDelay().toMillis();
        log.info("Candle stream reconnecting in {} ms", delay);
        scheduler.schedule(this::connect, delay, TimeUnit.MILLISECONDS);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Subscription serialization failed", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        stopping = true;
        WebSocket ws = webSocket;
        if (ws != null) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "shutdown");
        }
        scheduler.shutdownNow();
    }

    private class CandleListener implements WebSocket.Listener {

        private final StringBuilder buffer = new StringBuilder();

        @Override
        public void onOpen(WebSocket ws) {
            log.info("Candle stream open");
            ws.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            buffer.append(data);
            if (last) {
                String message = buffer.toString();
                buffer.setLength(0);
                try {
                    onMessage(message);
                } catch (RuntimeException e) {
                    log.error("Candle processing failed: {}", e.getMessage(), e);
                }
            }
            ws.request(1);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int status, String reason) {
            log.warn("Candle stream closed: status={}, reason={}", status, reason);
            scheduleReconnect();
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            log.error("Candle stream error: {}", error.getMessage());
            scheduleReconnect();
        }
    }
}

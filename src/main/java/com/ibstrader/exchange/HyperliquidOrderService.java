package com.ibstrader.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.ibstrader.config.ExchangeConfig;
import com.ibstrader.domain.model.LimitOrderRequest;
import com.ibstrader.domain.model.OrderAck;
import com.ibstrader.exception.ExchangeException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Signed write actions against the Hyperliquid {@code /exchange} endpoint.
 *
 * <p>Internal to {@link HyperliquidExchangeGateway}. Rate limited and circuit broken like
 * the info calls, but never retried: a placement that timed out may still have reached
 * the book, and sending it again would double the position.
 */
@Service
public class HyperliquidOrderService {

    private static final Logger log = LoggerFactory.getLogger(HyperliquidOrderService.class);

    private final RestClient restClient;
    private final HyperliquidSigner signer;
    private final ExchangeConfig exchangeConfig;

    public HyperliquidOrderService(
            @Qualifier("hyperliquidRestClient") RestClient restClient,
            HyperliquidSigner signer,
            ExchangeConfig exchangeConfig) {
        this.restClient = restClient;
        this.signer = signer;
        this.exchangeConfig = exchangeConfig;
    }

    /**
     * Places one GTC limit order.
     *
     * @return FILLED, RESTING or ERROR as reported for the order
     * @throws ExchangeException if the request as a whole failed or was refused
     */
    @RateLimiter(name = "hyperliquidApi")
    @CircuitBreaker(name = "hyperliquidApi")
    public OrderAck placeOrder(int asset, LimitOrderRequest request) {
        Map<String, Object> action = HyperliquidWire.orderAction(HyperliquidWire.orderWire(asset, request));
        OrderAck ack = firstStatus(send("order", action));
        log.info(
                "Order placed: symbol={}, side={}, size={}, price={}, reduceOnly={}, cloid={}, status={}, oid={}",
                request.getSymbol(),
                request.getSide(),
                request.getSize(),
                request.getPrice(),
                request.isReduceOnly(),
                request.getClientOrderId(),
                ack.getStatus(),
                ack.getOrderId());
        return ack;
    }

    /**
     * Replaces a resting order with {@code request}. {@code oid} is the exchange order id
     * or the client order id.
     */
    @RateLimiter(name = "hyperliquidApi")
    @CircuitBreaker(name = "hyperliquidApi")
    public OrderAck modifyOrder(Object oid, int asset, LimitOrderRequest request) {
        Map<String, Object> action = HyperliquidWire.modifyAction(oid, HyperliquidWire.orderWire(asset, request));
        JsonNode response = send("modify", action);
        OrderAck ack = response.path("data").has("statuses")
                ? firstStatus(response)
                : OrderAck.resting(oid instanceof Long longOid ? longOid : null);
        log.info("Order modified: oid={}, price={}, status={}", oid, request.getPrice(), ack.getStatus());
        return ack;
    }

    @RateLimiter(name = "hyperliquidApi")
    @CircuitBreaker(name = "hyperliquidApi")
    public void updateLeverage(int asset, int leverage) {
        send("updateLeverage", HyperliquidWire.updateLeverageAction(asset, true, leverage));
        log.info("Leverage updated: asset={}, leverage={}x cross", asset, leverage);
    }

    /** Signs and posts an action, returning the {@code response} node of an ok answer. */
    private JsonNode send(String operation, Map<String, Object> action) {
        long nonce = System.currentTimeMillis();
        String vault = exchangeConfig.getVaultAddress();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", action);
        payload.put("nonce", nonce);
        payload.put("signature", signer.signAction(action, nonce, vault));
        payload.put("vaultAddress", vault);

        JsonNode root;
        try {
            root = restClient.post().uri("/exchange").body(payload).retrieve().body(JsonNode.class);
        } catch (RestClientException e) {
            log.error("Exchange request failed: operation={}, error={}", operation, e.getMessage());
            throw HyperliquidWire.translate(operation, e);
        }
        if (root == null || root.isNull()) {
            throw ExchangeException.unavailable("Empty exchange response for " + operation, null);
        }
        if (!"ok".equals(root.path("status").asText())) {
            String reason = root.path("response").isTextual() ? root.path("response").asText() : root.toString();
            log.error("Exchange refused {}: {}", operation, reason);
            throw ExchangeException.rejected(operation + " refused: " + reason);
        }
        return root.path("response");
    }

    private OrderAck firstStatus(JsonNode response) {
        JsonNode statuses = response.path("data").path("statuses");
        if (!statuses.isArray() || statuses.isEmpty()) {
            throw ExchangeException.unavailable("Exchange response has no order statuses: " + response, null);
        }
        JsonNode status = statuses.get(0);
        if (status.has("filled")) {
            JsonNode filled = status.get("filled");
            return OrderAck.filled(
                    filled.path("oid").asLong(),
                    new BigDecimal(filled.path("totalSz").asText("0")),
                    new BigDecimal(filled.path("avgPx").asText("0")));
        }
        if (status.has("resting")) {
            return OrderAck.resting(status.get("resting").path("oid").asLong());
        }
        if (status.has("error")) {
            return OrderAck.error(status.get("error").asText());
        }
        if (status.isTextual()) {
            // "success" for actions without per-order payloads
            return OrderAck.resting(null);
        }
        return OrderAck.error("Unrecognized order status: " + status);
    }
}

package com.ibstrader.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.ibstrader.config.ExchangeConfig;
import com.ibstrader.domain.enums.ExchangeOrderStatus;
import com.ibstrader.domain.enums.TradeSide;
import com.ibstrader.domain.model.AccountState;
import com.ibstrader.domain.model.ExchangeFill;
import com.ibstrader.domain.model.ExchangePosition;
import com.ibstrader.domain.model.OpenOrder;
import com.ibstrader.domain.model.OrderRef;
import com.ibstrader.domain.model.OrderStatusReport;
import com.ibstrader.exception.ConfigurationException;
import com.ibstrader.exception.ExchangeException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.github.resilience4j.retry.annotation.Retry;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Read-only queries against the Hyperliquid {@code /info} endpoint.
 *
 * <p>Internal to the exchange adapters: the live gateway uses every method, the paper
 * gateway only the public ones ({@link #allMids()}, {@link #meta()}). Responses are parsed
 * from Jackson trees into domain objects here so nothing untyped leaves this class.
 *
 * <p>Resilience4j decorators:
 * <ul>
 *   <li><b>Rate limiter</b> ({@code hyperliquidApi}): shared with the order service</li>
 *   <li><b>Circuit breaker</b> ({@code hyperliquidApi})</li>
 *   <li><b>Retry</b> ({@code hyperliquidInfo}): transient failures only, reads are idempotent</li>
 * </ul>
 */
@Service
public class HyperliquidInfoService {

    private static final Logger log = LoggerFactory.getLogger(HyperliquidInfoService.class);

    private final RestClient restClient;
    private final ExchangeConfig exchangeConfig;

    public HyperliquidInfoService(
            @Qualifier("hyperliquidRestClient") RestClient restClient, ExchangeConfig exchangeConfig) {
        this.restClient = restClient;
        this.exchangeConfig = exchangeConfig;
    }

    /** Mid prices keyed by coin. */
    @RateLimiter(name = "hyperliquidApi")
    @CircuitBreaker(name = "hyperliquidApi")
    @Retry(name = "hyperliquidInfo")
    public Map<String, BigDecimal> allMids() {
        JsonNode root = post("allMids", request("allMids"));
        Map<String, BigDecimal> mids = new HashMap<>();
        root.fields().forEachRemaining(entry -> {
            BigDecimal mid = decimal(entry.getValue());
            if (mid != null) {
                mids.put(entry.getKey(), mid);
            }
        });
        return mids;
    }

    /** The perpetuals universe in asset-index order. */
    @RateLimiter(name = "hyperliquidApi")
    @CircuitBreaker(name = "hyperliquidApi")
    @Retry(name = "hyperliquidInfo")
    public List<AssetMeta> meta() {
        JsonNode universe = post("meta", request("meta")).path("universe");
        if (!universe.isArray()) {
            throw ExchangeException.unavailable("meta response has no universe", null);
        }
        List<AssetMeta> assets = new ArrayList<>();
        for (int i = 0; i < universe.size(); i++) {
            JsonNode asset = universe.get(i);
            assets.add(new AssetMeta(
                    asset.path("name").asText(),
                    i,
                    asset.path("szDecimals").asInt(),
                    asset.path("maxLeverage").asInt(1)));
        }
        return assets;
    }

    @RateLimiter(name = "hyperliquidApi")
    @CircuitBreaker(name = "hyperliquidApi")
    @Retry(name = "hyperliquidInfo")
    public AccountState clearinghouseState() {
        JsonNode root = post("clearinghouseState", userRequest("clearinghouseState"));
        BigDecimal withdrawable = decimal(root.path("withdrawable"));
        if (withdrawable == null) {
            throw ExchangeException.unavailable("clearinghouseState has no withdrawable", null);
        }
        List<ExchangePosition> positions = new ArrayList<>();
        for (JsonNode assetPosition : root.path("assetPositions")) {
            JsonNode position = assetPosition.path("position");
            BigDecimal size = decimal(position.path("szi"));
            if (size == null) {
                log.warn("Skipping position without size: {}", position);
                continue;
            }
            positions.add(ExchangePosition.builder()
                    .symbol(position.path("coin").asText())
                    .size(size)
                    .entryPrice(decimal(position.path("entryPx")))
                    .build());
        }
        return AccountState.builder().withdrawable(withdrawable).positions(positions).build();
    }

    /**
     * Looks up one order. Returns {@link ExchangeOrderStatus#UNKNOWN} when the exchange does
     * not (yet) know the id; callers treat that as an unreliable answer.
     */
    @RateLimiter(name = "hyperliquidApi")
    @CircuitBreaker(name = "hyperliquidApi")
    @Retry(name = "hyperliquidInfo")
    public OrderStatusReport orderStatus(OrderRef ref) {
        Map<String, Object> body = userRequest("orderStatus");
        body.put("oid", ref.clientOrderId() != null ? ref.clientOrderId() : ref.orderId());
        JsonNode root = post("orderStatus", body);

        if (!"order".equals(root.path("status").asText())) {
            log.debug("Order status not available: ref={}, status={}", ref, root.path("status").asText());
            return OrderStatusReport.unknown();
        }
        JsonNode wrapper = root.path("order");
        JsonNode order = wrapper.path("order");
        return OrderStatusReport.builder()
                .status(ExchangeOrderStatus.fromExchange(wrapper.path("status").asText()))
                .orderId(order.hasNonNull("oid") ? order.get("oid").asLong() : ref.orderId())
                .clientOrderId(order.hasNonNull("cloid") ? order.get("cloid").asText() : ref.clientOrderId())
                .build();
    }

    @RateLimiter(name = "hyperliquidApi")
    @CircuitBreaker(name = "hyperliquidApi")
    @Retry(name = "hyperliquidInfo")
    public List<OpenOrder> openOrders() {
        JsonNode root = post("frontendOpenOrders", userRequest("frontendOpenOrders"));
        List<OpenOrder> orders = new ArrayList<>();
        for (JsonNode order : root) {
            orders.add(OpenOrder.builder()
                    .orderId(order.path("oid").asLong())
                    .clientOrderId(order.hasNonNull("cloid") ? order.get("cloid").asText() : null)
                    .symbol(order.path("coin").asText())
                    .side(side(order.path("side").asText()))
                    .limitPrice(decimal(order.path("limitPx")))
                    .size(decimal(order.path("sz")))
                    .build());
        }
        return orders;
    }

    @RateLimiter(name = "hyperliquidApi")
    @CircuitBreaker(name = "hyperliquidApi")
    @Retry(name = "hyperliquidInfo")
    public List<ExchangeFill> userFills() {
        JsonNode root = post("userFills", userRequest("userFills"));
        List<ExchangeFill> fills = new ArrayList<>();
        for (JsonNode fill : root) {
            fills.add(ExchangeFill.builder()
                    .orderId(fill.hasNonNull("oid") ? fill.get("oid").asLong() : null)
                    .clientOrderId(fill.hasNonNull("cloid") ? fill.get("cloid").asText() : null)
                    .symbol(fill.path("coin").asText())
                    .side(side(fill.path("side").asText()))
                    .price(decimal(fill.path("px")))
                    .size(decimal(fill.path("sz")))
                    .time(fill.hasNonNull("time") ? Instant.ofEpochMilli(fill.get("time").asLong()) : null)
                    .build());
        }
        return fills;
    }

    private JsonNode post(String type, Map<String, Object> body) {
        JsonNode root;
        try {
            root = restClient.post().uri("/info").body(body).retrieve().body(JsonNode.class);
        } catch (RestClientException e) {
            log.error("Info request failed: type={}, error={}", type, e.getMessage());
            throw HyperliquidWire.translate("info " + type, e);
        }
        if (root == null || root.isNull()) {
            throw ExchangeException.unavailable("Empty info response for " + type, null);
        }
        return root;
    }

    private Map<String, Object> request(String type) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", type);
        return body;
    }

    private Map<String, Object> userRequest(String type) {
        String user = exchangeConfig.getAccountAddress();
        if (user == null || user.isBlank()) {
            throw new ConfigurationException("ibstrader.exchange.account-address (HL_ACCOUNT_ADDRESS) is not set");
        }
        Map<String, Object> body = request(type);
        body.put("user", user);
        return body;
    }

    /** Exchange sides: "B" is bid (buy), "A" is ask (sell). */
    private static TradeSide side(String code) {
        return "B".equals(code) ? TradeSide.LONG : TradeSide.SHORT;
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        try {
            return new BigDecimal(node.asText());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

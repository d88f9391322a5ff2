package com.ibstrader.exchange;

import com.ibstrader.domain.model.LimitOrderRequest;
import com.ibstrader.exception.ExchangeException;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.security.SecureRandom;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.web3j.utils.Numeric;

/**
 * Wire-level helpers for Hyperliquid: action payloads, number formatting, client order
 * ids and the msgpack encoding that action hashes are computed over.
 *
 * <p>Key order inside every action map is significant: the exchange re-encodes the
 * action it receives and compares hashes, so maps are built as {@link LinkedHashMap}s in
 * the exchange's field order.
 */
public final class HyperliquidWire {

    private static final int MAX_WIRE_DECIMALS = 8;
    private static final SecureRandom RANDOM = new SecureRandom();

    private HyperliquidWire() {}

    /**
     * Formats a price or size the way the exchange expects: at most eight fractional
     * digits, no trailing zeros, no exponent.
     *
     * @throws IllegalArgumentException if the value needs more than eight decimals
     */
    public static String decimalToWire(BigDecimal value) {
        BigDecimal rounded = value.setScale(MAX_WIRE_DECIMALS, RoundingMode.HALF_UP);
        if (rounded.compareTo(value) != 0) {
            throw new IllegalArgumentException("Value has more than " + MAX_WIRE_DECIMALS + " decimals: " + value);
        }
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.stripTrailingZeros().toPlainString();
    }

    /** A fresh 128-bit client order id as 0x-prefixed lowercase hex. */
    public static String newClientOrderId() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return Numeric.toHexString(bytes);
    }

    public static Map<String, Object> orderWire(int asset, LimitOrderRequest request) {
        Map<String, Object> tif = new LinkedHashMap<>();
        tif.put("tif", "Gtc");
        Map<String, Object> orderType = new LinkedHashMap<>();
        orderType.put("limit", tif);

        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("a", asset);
        wire.put("b", request.getSide().isBuy());
        wire.put("p", decimalToWire(request.getPrice()));
        wire.put("s", decimalToWire(request.getSize()));
        wire.put("r", request.isReduceOnly());
        wire.put("t", orderType);
        if (request.getClientOrderId() != null) {
            wire.put("c", request.getClientOrderId());
        }
        return wire;
    }

    public static Map<String, Object> orderAction(Map<String, Object> orderWire) {
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("type", "order");
        action.put("orders", List.of(orderWire));
        action.put("grouping", "na");
        return action;
    }

    /** {@code oid} is either the numeric order id or the client order id string. */
    public static Map<String, Object> modifyAction(Object oid, Map<String, Object> orderWire) {
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("type", "modify");
        action.put("oid", oid);
        action.put("order", orderWire);
        return action;
    }

    public static Map<String, Object> updateLeverageAction(int asset, boolean cross, int leverage) {
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("type", "updateLeverage");
        action.put("asset", asset);
        action.put("isCross", cross);
        action.put("leverage", leverage);
        return action;
    }

    /** msgpack encoding of an action tree made of maps, lists, strings, booleans and integers. */
    public static byte[] pack(Object value) {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            packValue(packer, value);
            return packer.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("msgpack encoding failed", e);
        }
    }

    /**
     * Maps a transport-level failure to an {@link ExchangeException}. 4xx answers are the
     * exchange refusing the request; everything else is transient.
     */
    public static ExchangeException translate(String operation, RestClientException e) {
        if (e instanceof RestClientResponseException responseException
                && responseException.getStatusCode().is4xxClientError()) {
            return ExchangeException.rejected(operation + " rejected: HTTP "
                    + responseException.getStatusCode().value() + " " + responseException.getResponseBodyAsString());
        }
        return ExchangeException.unavailable(operation + " failed: " + e.getMessage(), e);
    }

    @SuppressWarnings("unchecked")
    private static void packValue(MessageBufferPacker packer, Object value) throws IOException {
        if (value == null) {
            packer.packNil();
        } else if (value instanceof String s) {
            packer.packString(s);
        } else if (value instanceof Boolean b) {
            packer.packBoolean(b);
        } else if (value instanceof Integer || value instanceof Long) {
            packer.packLong(((Number) value).longValue());
        } else if (value instanceof Map<?, ?> map) {
            packer.packMapHeader(map.size());
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) map).entrySet()) {
                packer.packString(entry.getKey());
                packValue(packer, entry.getValue());
            }
        } else if (value instanceof List<?> list) {
            packer.packArrayHeader(list.size());
            for (Object element : list) {
                packValue(packer, element);
            }
        } else {
            throw new IllegalArgumentException("Unsupported action value type: " + value.getClass());
        }
    }
}

package com.ibstrader.marketdata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ibstrader.domain.model.MinuteBar;
import com.ibstrader.exception.InvalidBarException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Parses candle-channel messages from the Hyperliquid WebSocket into {@link MinuteBar}s.
 *
 * <p>Messages on other channels (subscription acks, pongs) yield an empty result. A candle
 * payload with missing fields, non-numeric or non-finite values, or high below low raises
 * {@link InvalidBarException}.
 */
@Component
public class CandleMessageParser {

    private final ObjectMapper objectMapper;

    public CandleMessageParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<MinuteBar> parse(String message) {
        JsonNode root;
        try {
            root = objectMapper.readTree(message);
        } catch (JsonProcessingException e) {
            throw new InvalidBarException("Unreadable stream message: " + e.getOriginalMessage());
        }
        if (!"candle".equals(root.path("channel").asText())) {
            return Optional.empty();
        }
        JsonNode data = root.path("data");
        if (!data.isObject()) {
            throw new InvalidBarException("Candle message without data");
        }
        if (!data.path("T").canConvertToLong()) {
            throw new InvalidBarException("Candle without close time", Map.of("data", data.toString()));
        }

        MinuteBar bar = MinuteBar.builder()
                .closeTime(Instant.ofEpochMilli(data.get("T").asLong()))
                .open(number(data, "o"))
                .high(number(data, "h"))
                .low(number(data, "l"))
                .close(number(data, "c"))
                .volume(number(data, "v"))
                .build();
        if (bar.getHigh().compareTo(bar.getLow()) < 0) {
            throw new InvalidBarException("Candle high below low",
                    Map.of("closeTime", bar.getCloseTime().toString(), "high", bar.getHigh(), "low", bar.getLow()));
        }
        return Optional.of(bar);
    }

    private static BigDecimal number(JsonNode data, String field) {
        JsonNode node = data.get(field);
        if (node == null || node.isNull()) {
            throw new InvalidBarException("Candle field missing: " + field);
        }
        String text = node.asText();
        try {
            double value = Double.parseDouble(text);
            if (!Double.isFinite(value)) {
                throw new InvalidBarException("Candle field not finite: " + field + "=" + text);
            }
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new InvalidBarException("Candle field not numeric: " + field + "=" + text);
        }
    }
}

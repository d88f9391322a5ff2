package com.ibstrader.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Connection settings for the Hyperliquid API.
 *
 * <p>Binds to {@code ibstrader.exchange.*}. The account address and API secret come from
 * the environment ({@code HL_ACCOUNT_ADDRESS}, {@code HL_API_SECRET}) and are only
 * required in LIVE mode. The secret may belong to an API (agent) wallet; the account
 * address is always the master account whose state is queried.
 */
@Configuration
@ConfigurationProperties(prefix = "ibstrader.exchange")
@Getter
@Setter
public class ExchangeConfig {

    private static final Logger log = LoggerFactory.getLogger(ExchangeConfig.class);

    public static final String MAINNET_URL = "https://api.hyperliquid.xyz";

    /** REST base URL; {@code /info} and {@code /exchange} are appended. */
    private String baseUrl = MAINNET_URL;

    /** WebSocket endpoint for the candle stream. */
    private String wsUrl = "wss://api.hyperliquid.xyz/ws";

    private String accountAddress;

    private String apiSecret;

    /** Optional vault (sub-account) address that orders are placed for. */
    private String vaultAddress;

    private int connectTimeout = 5000;

    private int readTimeout = 10000;

    /** Mainnet signs with source "a", everything else with "b". */
    public boolean isMainnet() {
        return MAINNET_URL.equals(baseUrl);
    }

    @Bean
    public RestClient hyperliquidRestClient() {
        log.info("Creating Hyperliquid RestClient: baseUrl={}, mainnet={}", baseUrl, isMainnet());
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return RestClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .requestFactory(requestFactory)
                .build();
    }
}

package com.ibstrader.domain.enums;

/** LIVE routes orders to Hyperliquid; PAPER routes them to the in-memory paper book. */
public enum TradingMode {
    LIVE,
    PAPER
}

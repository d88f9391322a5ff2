package com.ibstrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR"),
    INVALID_MARKET_DATA("INVALID_MARKET_DATA"),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR"),
    EXCHANGE_REJECTED("EXCHANGE_REJECTED"),
    EXCHANGE_UNAVAILABLE("EXCHANGE_UNAVAILABLE"),
    INTERNAL_ERROR("INTERNAL_ERROR");

    private final String code;
}

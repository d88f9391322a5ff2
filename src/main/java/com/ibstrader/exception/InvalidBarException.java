package com.ibstrader.exception;

import java.util.Map;

/** A price bar that cannot be used: non-finite prices or high below low. */
public class InvalidBarException extends BaseException {

    public InvalidBarException(String message) {
        super(ErrorCode.INVALID_MARKET_DATA, message);
    }

    public InvalidBarException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_MARKET_DATA, message, details);
    }
}

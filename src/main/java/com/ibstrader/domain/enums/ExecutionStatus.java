package com.ibstrader.domain.enums;

/**
 * Execution flag of a signal, persisted as an integer column.
 * PENDING transitions exactly once to EXECUTED or FAILED and never back.
 */
public enum ExecutionStatus {
    PENDING(0),
    EXECUTED(1),
    FAILED(2);

    private final int code;

    ExecutionStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public static ExecutionStatus fromCode(int code) {
        for (ExecutionStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown execution status code: " + code);
    }
}

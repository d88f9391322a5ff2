package com.ibstrader.domain.enums;

/**
 * What a signal asks the execution engine to do. Stored lowercase ("open", "close").
 * UNKNOWN stands for any other stored value; such signals are never executed.
 */
public enum SignalAction {
    OPEN("open"),
    CLOSE("close"),
    UNKNOWN("");

    private final String code;

    SignalAction(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static SignalAction fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        for (SignalAction action : values()) {
            if (action != UNKNOWN && action.code.equalsIgnoreCase(code.trim())) {
                return action;
            }
        }
        return UNKNOWN;
    }
}

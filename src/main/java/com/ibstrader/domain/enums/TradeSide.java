package com.ibstrader.domain.enums;

/** Direction of a trade. LONG buys on entry, SHORT sells. Stored lowercase. */
public enum TradeSide {
    LONG("long"),
    SHORT("short");

    private final String code;

    TradeSide(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isBuy() {
        return this == LONG;
    }

    /** Returns the side that reduces a position of this side: LONG -> SHORT, SHORT -> LONG. */
    public TradeSide opposite() {
        return this == LONG ? SHORT : LONG;
    }

    /** Returns null for values that are neither "long" nor "short". */
    public static TradeSide fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TradeSide side : values()) {
            if (side.code.equalsIgnoreCase(code.trim())) {
                return side;
            }
        }
        return null;
    }
}

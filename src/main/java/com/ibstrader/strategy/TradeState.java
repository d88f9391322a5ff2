package com.ibstrader.strategy;

import java.time.Instant;
import lombok.Getter;

/** The decision process's view of whether it has a trade open, and since when. */
@Getter
public class TradeState {

    private boolean active;
    private Instant entryTime;
    private int leverage = 1;

    public void open(Instant entryTime, int leverage) {
        this.active = true;
        this.entryTime = entryTime;
        this.leverage = leverage;
    }

    public void reset() {
        this.active = false;
        this.entryTime = null;
        this.leverage = 1;
    }

    @Override
    public String toString() {
        return active ? "active(since=" + entryTime + ", leverage=" + leverage + ")" : "flat";
    }
}

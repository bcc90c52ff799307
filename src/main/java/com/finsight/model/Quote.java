package com.finsight.model;

import java.time.Instant;

public final class Quote {
    public final Symbol symbol;
    public final double price;
    public final Instant timestamp;

    public Quote(Symbol symbol, double price, Instant timestamp) {
        this.symbol = symbol;
        this.price = price;
        this.timestamp = timestamp;
    }
}

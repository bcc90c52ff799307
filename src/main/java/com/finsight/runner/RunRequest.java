package com.finsight.runner;

import com.finsight.model.SymbolSet;

import java.time.Instant;

public final class RunRequest {
    public final SymbolSet symbols;
    public final Instant asOf;
    public final boolean forceRefresh;
    public final String trigger;

    public RunRequest(SymbolSet symbols, Instant asOf, boolean forceRefresh, String trigger) {
        this.symbols = symbols;
        this.asOf = asOf;
        this.forceRefresh = forceRefresh;
        this.trigger = trigger == null || trigger.isBlank() ? "manual" : trigger.trim();
    }

    public RunRequest(SymbolSet symbols, Instant asOf, boolean forceRefresh) {
        this(symbols, asOf, forceRefresh, "manual");
    }
}

package com.finsight.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class FeatureRow {
    public final LocalDate date;
    public final double close;
    public final double volume;
    public final double returnPct;
    public final Map<Integer, Double> sma;
    public final double volatility;
    public final double rsi;
    public final double momentumPct;
    public final boolean gapFilled;

    public FeatureRow(
            LocalDate date,
            double close,
            double volume,
            double returnPct,
            Map<Integer, Double> sma,
            double volatility,
            double rsi,
            double momentumPct,
            boolean gapFilled
    ) {
        this.date = date;
        this.close = close;
        this.volume = volume;
        this.returnPct = returnPct;
        this.sma = sma == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sma));
        this.volatility = volatility;
        this.rsi = rsi;
        this.momentumPct = momentumPct;
        this.gapFilled = gapFilled;
    }

    public double sma(int window) {
        Double value = sma.get(window);
        return value == null ? Double.NaN : value;
    }
}

package com.finsight.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Indicator windows used to build a FeatureSet.
 */
public final class FeatureSpec {
    public final List<Integer> smaWindows;
    public final int volatilityWindow;
    public final int rsiPeriod;
    public final int momentumPeriod;

    public FeatureSpec(List<Integer> smaWindows, int volatilityWindow, int rsiPeriod, int momentumPeriod) {
        TreeSet<Integer> sorted = new TreeSet<>();
        if (smaWindows != null) {
            for (Integer window : smaWindows) {
                if (window == null || window < 1) {
                    throw new IllegalArgumentException("sma window must be >= 1: " + window);
                }
                sorted.add(window);
            }
        }
        if (sorted.isEmpty()) {
            throw new IllegalArgumentException("at least one sma window is required");
        }
        if (volatilityWindow < 2 || rsiPeriod < 1 || momentumPeriod < 1) {
            throw new IllegalArgumentException("invalid feature windows vol=" + volatilityWindow
                    + " rsi=" + rsiPeriod + " momentum=" + momentumPeriod);
        }
        this.smaWindows = Collections.unmodifiableList(new ArrayList<>(sorted));
        this.volatilityWindow = volatilityWindow;
        this.rsiPeriod = rsiPeriod;
        this.momentumPeriod = momentumPeriod;
    }

    public static FeatureSpec defaults() {
        return new FeatureSpec(List.of(5, 20), 20, 14, 10);
    }

    /**
     * Number of leading cleaned bars without full indicator history.
     */
    public int warmUp() {
        int maxSma = smaWindows.get(smaWindows.size() - 1);
        return Math.max(Math.max(maxSma - 1, volatilityWindow), Math.max(rsiPeriod, momentumPeriod));
    }

    @Override
    public String toString() {
        return "sma=" + smaWindows + " vol=" + volatilityWindow + " rsi=" + rsiPeriod + " momentum=" + momentumPeriod;
    }
}

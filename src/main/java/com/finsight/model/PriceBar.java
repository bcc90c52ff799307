package com.finsight.model;

import java.time.LocalDate;

/**
 * 模块说明：PriceBar（class）。
 * 主要职责：单个交易日的 OHLCV 数据。
 * 使用建议：原始序列中 close 可能为 NaN 表示数据源缺口，经过 FeatureTransformer 清洗后 close 一定大于 0。
 */
public final class PriceBar {
    public final LocalDate tradeDate;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final double volume;

    public PriceBar(LocalDate tradeDate, double open, double high, double low, double close, double volume) {
        this.tradeDate = tradeDate;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    public static PriceBar gap(LocalDate tradeDate) {
        return new PriceBar(tradeDate, Double.NaN, Double.NaN, Double.NaN, Double.NaN, 0.0);
    }

    public boolean hasClose() {
        return Double.isFinite(close) && close > 0.0;
    }

    @Override
    public String toString() {
        return tradeDate + " o=" + open + " h=" + high + " l=" + low + " c=" + close + " v=" + volume;
    }
}

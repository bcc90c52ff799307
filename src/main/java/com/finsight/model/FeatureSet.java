package com.finsight.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

/**
 * 模块说明：FeatureSet（class）。
 * 主要职责：清洗后的价格序列加逐日特征行，以及来源原始序列的指纹。
 * 使用建议：rows 只包含预热期之后的交易日，与 cleanedBars 的尾部按日期一一对应。
 */
public final class FeatureSet {
    public final Symbol symbol;
    public final List<PriceBar> cleanedBars;
    public final List<FeatureRow> rows;
    public final FeatureSpec spec;
    public final String sourceFingerprint;

    public FeatureSet(Symbol symbol, List<PriceBar> cleanedBars, List<FeatureRow> rows, FeatureSpec spec, String sourceFingerprint) {
        this.symbol = symbol;
        this.cleanedBars = cleanedBars == null ? List.of() : Collections.unmodifiableList(List.copyOf(cleanedBars));
        this.rows = rows == null ? List.of() : Collections.unmodifiableList(List.copyOf(rows));
        this.spec = spec;
        this.sourceFingerprint = sourceFingerprint == null ? "" : sourceFingerprint;
    }

    public FeatureRow lastRow() {
        return rows.isEmpty() ? null : rows.get(rows.size() - 1);
    }

    public double lastClose() {
        return cleanedBars.isEmpty() ? Double.NaN : cleanedBars.get(cleanedBars.size() - 1).close;
    }

    public LocalDate lastDate() {
        return cleanedBars.isEmpty() ? null : cleanedBars.get(cleanedBars.size() - 1).tradeDate;
    }

    public double[] closes() {
        double[] out = new double[cleanedBars.size()];
        for (int i = 0; i < cleanedBars.size(); i++) {
            out[i] = cleanedBars.get(i).close;
        }
        return out;
    }

    public List<FeatureRow> recentRows(int count) {
        int n = Math.max(0, Math.min(count, rows.size()));
        return rows.subList(rows.size() - n, rows.size());
    }
}

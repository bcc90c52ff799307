package com.finsight.feature;

import com.finsight.errors.InsufficientHistoryError;
import com.finsight.model.FeatureRow;
import com.finsight.model.FeatureSet;
import com.finsight.model.FeatureSpec;
import com.finsight.model.PriceBar;
import com.finsight.model.RawSeries;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 模块说明：FeatureTransformer（class）。
 * 主要职责：清洗原始日线（排序、去重、缺口前向填充、OHLC 夹紧），并逐日计算收益率、均线、波动率、RSI 与动量。
 * 使用建议：纯函数，无外部状态；相同输入必须得到逐字节一致的 FeatureSet 编码。
 */
public final class FeatureTransformer {
    private final FeatureSpec spec;

    public FeatureTransformer(FeatureSpec spec) {
        this.spec = spec == null ? FeatureSpec.defaults() : spec;
    }

    public FeatureSpec spec() {
        return spec;
    }

/**
 * 方法说明：transform，负责把原始序列转换为特征集。
 * 处理流程：先 clean 得到连续收盘价，再从预热期之后的下标开始逐行输出特征；长度不足时抛出 InsufficientHistoryError。
 */
    public FeatureSet transform(RawSeries raw) throws InsufficientHistoryError {
        Cleaned cleaned = clean(raw.bars);
        int warmUp = spec.warmUp();
        int n = cleaned.bars.size();
        if (n <= warmUp) {
            throw new InsufficientHistoryError(warmUp + 1, n);
        }

        double[] closes = new double[n];
        for (int i = 0; i < n; i++) {
            closes[i] = cleaned.bars.get(i).close;
        }
        double[] returns = returnsPct(closes);
        double[] rsi = wilderRsi(closes, spec.rsiPeriod);

        List<FeatureRow> rows = new ArrayList<>(n - warmUp);
        for (int i = warmUp; i < n; i++) {
            Map<Integer, Double> sma = new LinkedHashMap<>();
            for (int window : spec.smaWindows) {
                sma.put(window, mean(closes, i - window + 1, i));
            }
            PriceBar bar = cleaned.bars.get(i);
            rows.add(new FeatureRow(
                    bar.tradeDate,
                    bar.close,
                    bar.volume,
                    returns[i],
                    sma,
                    sampleStd(returns, i - spec.volatilityWindow + 1, i),
                    rsi[i],
                    pct(closes[i], closes[i - spec.momentumPeriod]),
                    cleaned.gapFilled.get(i)
            ));
        }
        return new FeatureSet(raw.symbol, cleaned.bars, rows, spec, raw.fingerprint());
    }

    /**
     * Sorted, date-unique bars with a positive close on every date.
     */
    public List<PriceBar> cleanBars(List<PriceBar> bars) {
        return clean(bars).bars;
    }

    private Cleaned clean(List<PriceBar> input) {
        TreeMap<LocalDate, PriceBar> byDate = new TreeMap<>();
        for (PriceBar bar : input) {
            if (bar != null && bar.tradeDate != null) {
                byDate.put(bar.tradeDate, bar);
            }
        }

        List<PriceBar> out = new ArrayList<>(byDate.size());
        List<Boolean> gapFilled = new ArrayList<>(byDate.size());
        double prevClose = Double.NaN;
        for (PriceBar bar : byDate.values()) {
            if (!bar.hasClose()) {
                if (Double.isNaN(prevClose)) {
                    // leading gap
                    continue;
                }
                out.add(new PriceBar(bar.tradeDate, prevClose, prevClose, prevClose, prevClose, 0.0));
                gapFilled.add(Boolean.TRUE);
                continue;
            }
            double close = bar.close;
            double open = finitePositive(bar.open) ? bar.open : close;
            double high = finitePositive(bar.high) ? bar.high : Math.max(open, close);
            double low = finitePositive(bar.low) ? bar.low : Math.min(open, close);
            high = Math.max(high, Math.max(open, close));
            low = Math.min(low, Math.min(open, close));
            double volume = Double.isFinite(bar.volume) && bar.volume > 0.0 ? bar.volume : 0.0;
            out.add(new PriceBar(bar.tradeDate, open, high, low, close, volume));
            gapFilled.add(Boolean.FALSE);
            prevClose = close;
        }
        return new Cleaned(out, gapFilled);
    }

    static double[] returnsPct(double[] closes) {
        double[] out = new double[closes.length];
        for (int i = 1; i < closes.length; i++) {
            out[i] = pct(closes[i], closes[i - 1]);
        }
        return out;
    }

    /**
     * Wilder-smoothed RSI; entries before {@code period} are NaN.
     */
    static double[] wilderRsi(double[] closes, int period) {
        double[] out = new double[closes.length];
        Arrays.fill(out, Double.NaN);
        if (closes.length <= period) {
            return out;
        }
        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i <= period; i++) {
            double diff = closes[i] - closes[i - 1];
            if (diff >= 0) {
                gain += diff;
            } else {
                loss -= diff;
            }
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;
        out[period] = rsiValue(avgGain, avgLoss);

        for (int i = period + 1; i < closes.length; i++) {
            double diff = closes[i] - closes[i - 1];
            double currentGain = diff > 0 ? diff : 0.0;
            double currentLoss = diff < 0 ? -diff : 0.0;
            avgGain = (avgGain * (period - 1) + currentGain) / period;
            avgLoss = (avgLoss * (period - 1) + currentLoss) / period;
            out[i] = rsiValue(avgGain, avgLoss);
        }
        return out;
    }

    private static double rsiValue(double avgGain, double avgLoss) {
        if (avgLoss == 0.0) {
            return avgGain == 0.0 ? 50.0 : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i <= to; i++) {
            sum += values[i];
        }
        return sum / (to - from + 1);
    }

    private static double sampleStd(double[] values, int from, int to) {
        int count = to - from + 1;
        if (count < 2) {
            return 0.0;
        }
        double avg = mean(values, from, to);
        double sq = 0.0;
        for (int i = from; i <= to; i++) {
            double d = values[i] - avg;
            sq += d * d;
        }
        return Math.sqrt(sq / (count - 1));
    }

    private static double pct(double value, double base) {
        if (base == 0.0) {
            return 0.0;
        }
        return (value / base - 1.0) * 100.0;
    }

    private static boolean finitePositive(double value) {
        return Double.isFinite(value) && value > 0.0;
    }

    private static final class Cleaned {
        private final List<PriceBar> bars;
        private final List<Boolean> gapFilled;

        private Cleaned(List<PriceBar> bars, List<Boolean> gapFilled) {
            this.bars = bars;
            this.gapFilled = gapFilled;
        }
    }
}

package com.finsight.insight;

import com.finsight.model.FeatureRow;
import com.finsight.model.FeatureSet;
import com.finsight.model.ForecastArtifact;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 模块说明：InsightPromptBuilder（class）。
 * 主要职责：组装有长度上限的提示词：角色说明、最近若干特征行、区间统计，以及可选的预测结果。
 * 使用建议：没有预测时提示词中不得出现任何预测数值，模型输出因此也不会引用预测。
 */
public final class InsightPromptBuilder {
    static final String SYSTEM_PROMPT = "You are a financial analyst bot writing one-line commentary for a market dashboard.";

    private final int recentRows;
    private final int maxPromptChars;

    public InsightPromptBuilder(int recentRows, int maxPromptChars) {
        this.recentRows = Math.max(1, recentRows);
        this.maxPromptChars = Math.max(200, maxPromptChars);
    }

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String userPrompt(FeatureSet features, Optional<ForecastArtifact> forecast, Instant asOf) {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("Analyze the following recent stock data for ").append(features.symbol.value)
                .append(" (as of ").append(asOf).append(", last trade date ").append(features.lastDate()).append(").\n\n");

        List<FeatureRow> rows = features.recentRows(recentRows);
        sb.append("date,close,return_pct");
        FeatureRow last = features.lastRow();
        if (last != null) {
            for (Integer window : last.sma.keySet()) {
                sb.append(",sma").append(window);
            }
        }
        sb.append(",volatility_pct,rsi,momentum_pct,volume\n");
        for (FeatureRow row : rows) {
            sb.append(row.date).append(',')
                    .append(fmt(row.close)).append(',')
                    .append(fmt(row.returnPct));
            for (Map.Entry<Integer, Double> entry : row.sma.entrySet()) {
                sb.append(',').append(fmt(entry.getValue()));
            }
            sb.append(',').append(fmt(row.volatility))
                    .append(',').append(fmt(row.rsi))
                    .append(',').append(fmt(row.momentumPct))
                    .append(',').append((long) row.volume)
                    .append('\n');
        }

        sb.append("\nSummary: latest close ").append(fmt(features.lastClose()))
                .append(", period return ").append(fmt(periodReturnPct(rows))).append("%")
                .append(", average volatility ").append(fmt(averageVolatility(rows))).append("%.\n");

        if (forecast.isPresent()) {
            ForecastArtifact f = forecast.get();
            sb.append("Model forecast for the next session: close ").append(fmt(f.predictedClose))
                    .append(" (").append(f.direction).append(", ")
                    .append(signed(f.predictedChangePct)).append("%).\n");
        }

        sb.append("\nProvide a concise, 1-sentence financial insight suitable for a dashboard. ")
                .append("Focus on trend, volatility, and volume. Do not use markdown. Do not give financial advice.");

        return truncate(sb.toString(), maxPromptChars - SYSTEM_PROMPT.length());
    }

    static double periodReturnPct(List<FeatureRow> rows) {
        if (rows.size() < 2 || rows.get(0).close == 0.0) {
            return 0.0;
        }
        return (rows.get(rows.size() - 1).close / rows.get(0).close - 1.0) * 100.0;
    }

    static double averageVolatility(List<FeatureRow> rows) {
        if (rows.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (FeatureRow row : rows) {
            sum += row.volatility;
        }
        return sum / rows.size();
    }

    static String fmt(double value) {
        return String.format(Locale.US, "%.2f", value);
    }

    static String signed(double value) {
        return String.format(Locale.US, "%+.2f", value);
    }

    private static String truncate(String text, int max) {
        if (text.length() <= max) {
            return text;
        }
        return text.substring(0, Math.max(0, max));
    }
}

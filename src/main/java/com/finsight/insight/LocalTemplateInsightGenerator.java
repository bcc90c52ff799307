package com.finsight.insight;

import com.finsight.errors.InsightError;
import com.finsight.model.FeatureRow;
import com.finsight.model.FeatureSet;
import com.finsight.model.ForecastArtifact;
import com.finsight.model.InsightArtifact;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Deterministic commentary built from feature statistics, used when no chat model is configured.
 */
public final class LocalTemplateInsightGenerator implements InsightGenerator {
    public static final String MODEL_ID = "local-template";
    private static final double HIGH_VOLATILITY_PCT = 2.0;

    private final int recentRows;
    private final int maxChars;
    private final Clock clock;

    public LocalTemplateInsightGenerator(int recentRows, int maxChars, Clock clock) {
        this.recentRows = Math.max(2, recentRows);
        this.maxChars = Math.max(20, maxChars);
        this.clock = clock;
    }

    @Override
    public String sourceModelId() {
        return MODEL_ID;
    }

    @Override
    public InsightArtifact summarize(FeatureSet features, Optional<ForecastArtifact> forecast, Instant asOf) throws InsightError {
        FeatureRow last = features.lastRow();
        if (last == null) {
            throw new InsightError(features.symbol.value + ": no feature rows for commentary");
        }
        List<FeatureRow> rows = features.recentRows(recentRows);
        double avgVolume = 0.0;
        for (FeatureRow row : rows) {
            avgVolume += row.volume;
        }
        avgVolume = avgVolume / rows.size();
        double volatility = InsightPromptBuilder.averageVolatility(rows);
        String trend = last.returnPct > 0.0 ? "bullish" : "bearish";

        StringBuilder sb = new StringBuilder(256);
        sb.append(String.format(Locale.US,
                "%s closed at $%.2f, showing a %s move of %.2f%%. Volatility remains %s (%.2f%%), with an average volume of %,d shares.",
                features.symbol.value,
                last.close,
                trend,
                last.returnPct,
                volatility > HIGH_VOLATILITY_PCT ? "high" : "stable",
                volatility,
                Math.round(avgVolume)));
        if (forecast.isPresent()) {
            ForecastArtifact f = forecast.get();
            sb.append(String.format(Locale.US, " The model projects $%.2f (%s, %+.2f%%) for the next session.",
                    f.predictedClose, f.direction, f.predictedChangePct));
        }

        return InsightArtifact.builder()
                .symbol(features.symbol)
                .asOf(asOf)
                .dataAsOf(features.lastDate())
                .commentary(CommentarySanitizer.clean(sb.toString(), maxChars))
                .generatedAt(clock.instant())
                .sourceModelId(MODEL_ID)
                .forecastReferenced(forecast.isPresent())
                .inputFingerprint(features.sourceFingerprint)
                .build();
    }
}

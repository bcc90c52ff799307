package com.finsight.view;

import com.finsight.model.ForecastArtifact;
import com.finsight.model.InsightArtifact;
import com.finsight.model.Symbol;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * 模块说明：MarketView（class）。
 * 主要职责：面板读取结果，合并实时报价与最新已提交的预测、点评，并显式标注陈旧程度。
 * 使用建议：stale=true 时调用方必须展示 notice，不得把缓存价格当作实时价格。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class MarketView {
    public final Symbol symbol;
    public final FreshnessState freshness;
    public final Double price;
    public final Instant priceTimestamp;
    public final boolean stale;
    public final String notice;
    public final Long priceStalenessSeconds;
    public final ForecastArtifact forecast;
    public final Long forecastStalenessSeconds;
    public final InsightArtifact insight;
    public final Long insightStalenessSeconds;
    public final Instant generatedAt;

    public OptionalDouble livePrice() {
        return price == null ? OptionalDouble.empty() : OptionalDouble.of(price);
    }

    public Optional<ForecastArtifact> forecast() {
        return Optional.ofNullable(forecast);
    }

    public Optional<InsightArtifact> insight() {
        return Optional.ofNullable(insight);
    }

    /**
     * Maximum staleness over the components that are present.
     */
    public OptionalLong stalenessSeconds() {
        long max = -1L;
        for (Long value : new Long[]{priceStalenessSeconds, forecastStalenessSeconds, insightStalenessSeconds}) {
            if (value != null && value > max) {
                max = value;
            }
        }
        return max < 0L ? OptionalLong.empty() : OptionalLong.of(max);
    }
}

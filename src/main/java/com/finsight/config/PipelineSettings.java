package com.finsight.config;

import com.finsight.model.FeatureSpec;
import com.finsight.model.SymbolSet;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：PipelineSettings（class）。
 * 主要职责：从 Config 解析出经过校验的强类型配置快照，供编排器与各阶段组件使用。
 * 使用建议：非法取值在启动阶段即抛出 PipelineConfigurationException，不要在运行中途再做兜底。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PipelineSettings {
    public final SymbolSet symbols;
    public final int intervalHours;
    public final int concurrency;
    public final int symbolTimeoutSec;
    public final boolean insightAwaitForecast;
    public final int historyDays;

    public final int fetchMaxAttempts;
    public final long fetchBackoffMs;
    public final long fetchMaxBackoffMs;

    public final FeatureSpec featureSpec;

    public final String forecastModel;
    public final int lookBack;
    public final int forecastMinRows;
    public final int forecastEpochs;
    public final double forecastLearningRate;
    public final double deadband;
    public final int retrainMaxAgeHours;
    public final int retrainMaxNewBars;

    public final int insightRecentRows;
    public final int insightMaxPromptChars;
    public final int insightMaxChars;
    public final int aiTimeoutSec;

    public final long cachedFreshMaxAgeSec;
    public final long quoteCacheTtlSec;

    public static PipelineSettings from(Config config) {
        PipelineSettings settings = PipelineSettings.builder()
                .symbols(SymbolSet.of(config.getList("pipeline.symbols")))
                .intervalHours(config.getInt("pipeline.interval_hours"))
                .concurrency(config.getInt("pipeline.concurrency"))
                .symbolTimeoutSec(config.getInt("pipeline.symbol_timeout_sec"))
                .insightAwaitForecast(config.getBoolean("pipeline.insight.await_forecast", true))
                .historyDays(config.getInt("pipeline.history_days"))
                .fetchMaxAttempts(config.getInt("fetch.retry.max_attempts"))
                .fetchBackoffMs(config.getLong("fetch.retry.backoff_ms", 1000L))
                .fetchMaxBackoffMs(config.getLong("fetch.retry.max_backoff_ms", 30_000L))
                .featureSpec(featureSpec(config))
                .forecastModel(config.getString("forecast.model"))
                .lookBack(config.getInt("forecast.look_back"))
                .forecastMinRows(config.getInt("forecast.min_rows"))
                .forecastEpochs(config.getInt("forecast.epochs"))
                .forecastLearningRate(config.getDouble("forecast.learning_rate"))
                .deadband(config.getDouble("forecast.deadband"))
                .retrainMaxAgeHours(config.getInt("forecast.retrain.max_age_hours"))
                .retrainMaxNewBars(config.getInt("forecast.retrain.max_new_bars"))
                .insightRecentRows(config.getInt("insight.recent_rows"))
                .insightMaxPromptChars(config.getInt("insight.max_prompt_chars"))
                .insightMaxChars(config.getInt("insight.max_chars"))
                .aiTimeoutSec(config.getInt("ai.timeout_sec"))
                .cachedFreshMaxAgeSec(config.getLong("view.cached_fresh_max_age_sec", 43_200L))
                .quoteCacheTtlSec(config.getLong("view.quote_cache_ttl_sec", 60L))
                .build();
        settings.validate();
        return settings;
    }

    public void validate() {
        List<String> problems = new ArrayList<>();
        if (intervalHours < 1) {
            problems.add("pipeline.interval_hours must be >= 1");
        }
        if (concurrency < 1) {
            problems.add("pipeline.concurrency must be >= 1");
        }
        if (symbolTimeoutSec < 1) {
            problems.add("pipeline.symbol_timeout_sec must be >= 1");
        }
        if (historyDays < 1) {
            problems.add("pipeline.history_days must be >= 1");
        }
        if (fetchMaxAttempts < 1) {
            problems.add("fetch.retry.max_attempts must be >= 1");
        }
        if (fetchBackoffMs < 0 || fetchMaxBackoffMs < 0) {
            problems.add("fetch.retry backoff values must be >= 0");
        }
        if (lookBack < 1) {
            problems.add("forecast.look_back must be >= 1");
        }
        if (forecastEpochs < 1) {
            problems.add("forecast.epochs must be >= 1");
        }
        if (!(forecastLearningRate > 0.0) || !Double.isFinite(forecastLearningRate)) {
            problems.add("forecast.learning_rate must be > 0");
        }
        if (!(deadband >= 0.0) || !Double.isFinite(deadband)) {
            problems.add("forecast.deadband must be >= 0");
        }
        if (insightRecentRows < 1 || insightMaxPromptChars < 200 || insightMaxChars < 20) {
            problems.add("insight limits out of range");
        }
        if (aiTimeoutSec < 1) {
            problems.add("ai.timeout_sec must be >= 1");
        }
        if (cachedFreshMaxAgeSec < 0 || quoteCacheTtlSec < 0) {
            problems.add("view ages must be >= 0");
        }
        if (!problems.isEmpty()) {
            throw new PipelineConfigurationException("invalid configuration: " + String.join("; ", problems));
        }
    }

    private static FeatureSpec featureSpec(Config config) {
        List<Integer> windows = new ArrayList<>();
        for (String token : config.getList("features.sma_windows")) {
            try {
                windows.add(Integer.parseInt(token.trim()));
            } catch (NumberFormatException e) {
                throw new PipelineConfigurationException("invalid features.sma_windows entry: " + token, e);
            }
        }
        try {
            return new FeatureSpec(
                    windows,
                    config.getInt("features.volatility_window"),
                    config.getInt("features.rsi_period"),
                    config.getInt("features.momentum_period")
            );
        } catch (IllegalArgumentException e) {
            throw new PipelineConfigurationException(e.getMessage(), e);
        }
    }
}

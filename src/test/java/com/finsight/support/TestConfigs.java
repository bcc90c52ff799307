package com.finsight.support;

import com.finsight.config.Config;
import com.finsight.config.PipelineSettings;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Small-model configuration so pipeline tests train in milliseconds.
 */
public final class TestConfigs {
    private TestConfigs() {
    }

    public static Config config(Path workingDir, Map<String, String> extra) {
        Map<String, String> values = new HashMap<>();
        values.put("pipeline.symbols", "AAPL,MSFT");
        values.put("pipeline.concurrency", "2");
        values.put("pipeline.symbol_timeout_sec", "30");
        values.put("forecast.look_back", "10");
        values.put("forecast.min_rows", "40");
        values.put("forecast.epochs", "60");
        values.put("ai.provider", "local");
        values.put("ai.timeout_sec", "10");
        values.put("fetch.retry.backoff_ms", "100");
        values.put("fetch.retry.max_backoff_ms", "250");
        values.put("store.dir", "artifacts");
        values.put("runs.file", "runs/runs.jsonl");
        if (extra != null) {
            values.putAll(extra);
        }
        return Config.of(workingDir, values);
    }

    public static PipelineSettings settings(Path workingDir, Map<String, String> extra) {
        return PipelineSettings.from(config(workingDir, extra));
    }

    public static PipelineSettings settings(Path workingDir) {
        return settings(workingDir, Map.of());
    }
}

package com.finsight.config;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * 模块说明：Config（class）。
 * 主要职责：分层读取 classpath 与工作目录下的 config.properties，并提供带默认值的类型化访问。
 * 使用建议：新增配置项时同步补充 DEFAULTS，避免各调用点各自硬编码回退值。
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);
    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

/**
 * 方法说明：load，负责加载配置。
 * 处理流程：先读 classpath 资源，再用工作目录下的同名文件覆盖。
 */
    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.props.load(in);
            }
        } catch (IOException e) {
            LOG.warn("failed to read classpath config.properties: {}", e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.props.load(in);
            } catch (IOException e) {
                LOG.warn("failed to read {}: {}", local, e.getMessage());
            }
        }

        return config;
    }

    /**
     * Build Config from Spring-bound configuration properties.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    /**
     * Config backed only by the given overrides plus defaults. Used by tests and embedders.
     */
    public static Config of(Path workingDir, Map<String, String> overrides) {
        Config config = new Config(workingDir);
        if (overrides != null) {
            for (Map.Entry<String, String> entry : overrides.entrySet()) {
                putBoundValue(config, entry.getKey(), entry.getValue());
            }
        }
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

/**
 * 方法说明：getString，负责获取配置值，空白值回退到默认表。
 */
    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

/**
 * 方法说明：getPath，负责把相对路径解析到工作目录下。
 */
    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    /**
     * Environment variable first, then the config key.
     */
    public String secret(String envName, String key) {
        String env = System.getenv(envName);
        if (env != null && !env.trim().isEmpty()) {
            return env.trim();
        }
        return getString(key);
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<String> parts = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                parts.add(stringify(Array.get(value, i)));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (config == null || key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        try {
            return Double.parseDouble(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

/**
 * 方法说明：buildDefaults，负责构建默认配置表。
 * 维护提示：键名与 config.properties、Spring 绑定前缀保持一致。
 */
    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("pipeline.symbols", "AAPL,MSFT,TSLA,GOOGL,AMZN");
        defaults.put("pipeline.interval_hours", "6");
        defaults.put("pipeline.concurrency", "3");
        defaults.put("pipeline.symbol_timeout_sec", "300");
        defaults.put("pipeline.insight.await_forecast", "true");
        defaults.put("pipeline.history_days", "1825");

        defaults.put("market.provider", "yahoo");
        defaults.put("market.timeout_sec", "30");
        defaults.put("market.request_pause_ms", "0");
        defaults.put("market.yahoo.base_url", "https://query1.finance.yahoo.com/v8/finance/chart/");
        defaults.put("market.stooq.history_url", "https://stooq.com/q/d/l/?s=%s&i=d");
        defaults.put("market.stooq.quote_url", "https://stooq.com/q/l/?s=%s&f=sd2t2ohlcv&h&e=csv");
        defaults.put("market.stooq.suffix", ".us");

        defaults.put("fetch.retry.max_attempts", "3");
        defaults.put("fetch.retry.backoff_ms", "1000");
        defaults.put("fetch.retry.max_backoff_ms", "30000");

        defaults.put("features.sma_windows", "5,20");
        defaults.put("features.volatility_window", "20");
        defaults.put("features.rsi_period", "14");
        defaults.put("features.momentum_period", "10");

        defaults.put("forecast.model", "window-regression");
        defaults.put("forecast.look_back", "60");
        defaults.put("forecast.min_rows", "100");
        defaults.put("forecast.epochs", "400");
        defaults.put("forecast.learning_rate", "0.05");
        defaults.put("forecast.deadband", "0.5");
        defaults.put("forecast.retrain.max_age_hours", "168");
        defaults.put("forecast.retrain.max_new_bars", "5");

        defaults.put("insight.recent_rows", "5");
        defaults.put("insight.max_prompt_chars", "4000");
        defaults.put("insight.max_chars", "600");

        defaults.put("ai.provider", "ollama");
        defaults.put("ai.base_url", "http://127.0.0.1:11434");
        defaults.put("ai.model", "llama3.1:latest");
        defaults.put("ai.timeout_sec", "60");
        defaults.put("ai.max_tokens", "120");
        defaults.put("ai.temperature", "0.2");
        defaults.put("ai.openai.model", "gpt-4o-mini");

        defaults.put("store.type", "file");
        defaults.put("store.dir", "outputs/artifacts");
        defaults.put("runs.file", "outputs/runs/runs.jsonl");

        defaults.put("db.url", "jdbc:postgresql://localhost:5432/finsight");
        defaults.put("db.user", "finsight");
        defaults.put("db.pass", "finsight");
        defaults.put("db.schema", "finsight");
        defaults.put("db.connect_timeout_sec", "5");

        defaults.put("view.cached_fresh_max_age_sec", "43200");
        defaults.put("view.quote_cache_ttl_sec", "60");
        defaults.put("view.chat.support_window", "60");
        defaults.put("view.chat.recent_rows", "5");
        defaults.put("view.chat.news_items", "3");

        defaults.put("news.enabled", "true");
        defaults.put("news.limit", "5");
        defaults.put("news.timeout_sec", "20");
        defaults.put("news.yahoo.base_url", "https://feeds.finance.yahoo.com/rss/2.0/headline");
        defaults.put("news.region", "US");
        defaults.put("news.lang", "en-US");

        return Collections.unmodifiableMap(defaults);
    }
}

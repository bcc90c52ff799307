package com.finsight.config;

import com.finsight.model.Symbol;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsShouldMatchDocumentedValues() {
        PipelineSettings settings = PipelineSettings.from(Config.of(tempDir, Map.of()));

        assertEquals(List.of("AAPL", "MSFT", "TSLA", "GOOGL", "AMZN"),
                settings.symbols.asList().stream().map(s -> s.value).toList());
        assertEquals(6, settings.intervalHours);
        assertEquals(3, settings.concurrency);
        assertEquals(300, settings.symbolTimeoutSec);
        assertEquals(3, settings.fetchMaxAttempts);
        assertEquals(0.5, settings.deadband, 1e-12);
        assertEquals(List.of(5, 20), settings.featureSpec.smaWindows);
        assertTrue(settings.insightAwaitForecast);
        assertEquals(60, settings.aiTimeoutSec);
    }

    @Test
    void overridesShouldBeNormalized() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("pipeline.symbols", " nvda; aapl , NVDA ");
        values.put("pipeline.concurrency", "5");
        values.put("features.sma_windows", "20,5,50");
        values.put("pipeline.insight.await_forecast", "no");

        PipelineSettings settings = PipelineSettings.from(Config.of(tempDir, values));

        assertEquals(List.of(Symbol.of("NVDA"), Symbol.of("AAPL")), settings.symbols.asList());
        assertEquals(5, settings.concurrency);
        assertEquals(List.of(5, 20, 50), settings.featureSpec.smaWindows);
        assertFalse(settings.insightAwaitForecast);
    }

    @Test
    void invalidValuesShouldFailFast() {
        assertThrows(PipelineConfigurationException.class,
                () -> PipelineSettings.from(Config.of(tempDir, Map.of("pipeline.concurrency", "0"))));
        assertThrows(PipelineConfigurationException.class,
                () -> PipelineSettings.from(Config.of(tempDir, Map.of("forecast.deadband", "-1"))));
        assertThrows(PipelineConfigurationException.class,
                () -> PipelineSettings.from(Config.of(tempDir, Map.of("features.sma_windows", "5,x"))));
        assertThrows(PipelineConfigurationException.class,
                () -> PipelineSettings.from(Config.of(tempDir, Map.of("pipeline.symbols", "AAPL,BAD SYMBOL"))));
    }
}

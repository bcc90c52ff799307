package com.finsight.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void workingDirectoryFileShouldOverrideClasspathDefaults() throws Exception {
        Files.writeString(tempDir.resolve("config.properties"), "pipeline.concurrency=7\nmarket.provider=stooq\n");

        Config config = Config.load(tempDir);

        assertEquals(7, config.getInt("pipeline.concurrency"));
        assertEquals("stooq", config.getString("market.provider"));
        assertEquals(6, config.getInt("pipeline.interval_hours"));
    }

    @Test
    void typedAccessorsShouldFallBackOnBlankOrBadValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("pipeline.concurrency", "  ");
        values.put("forecast.deadband", "abc");
        values.put("custom.flag", "yes");

        Config config = Config.of(tempDir, values);

        assertEquals(3, config.getInt("pipeline.concurrency"));
        assertEquals(0.75, config.getDouble("forecast.deadband", 0.75), 1e-12);
        assertTrue(config.getBoolean("custom.flag"));
        assertEquals(tempDir.resolve("outputs/artifacts").normalize(), config.getPath("store.dir"));
        assertEquals("", config.getString("missing.key"));
    }

    @Test
    void springBoundMapsShouldFlattenToDottedKeys() {
        Map<String, Object> pipeline = new LinkedHashMap<>();
        pipeline.put("symbols", List.of("aapl", "msft"));
        pipeline.put("interval_hours", 4);
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("pipeline", pipeline);

        Config config = Config.fromConfigurationProperties(tempDir, root);

        assertEquals(List.of("aapl", "msft"), config.getList("pipeline.symbols"));
        assertEquals(4, config.getInt("pipeline.interval_hours"));
    }
}

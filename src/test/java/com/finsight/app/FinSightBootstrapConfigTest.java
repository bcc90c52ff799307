package com.finsight.app;

import com.finsight.config.PipelineSettings;
import com.finsight.model.SymbolSet;
import com.finsight.store.ArtifactStore;
import com.finsight.store.FileArtifactStore;
import com.finsight.view.HybridReadAccessor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FinSightBootstrapConfigTest {
    @TempDir
    Path tempDir;

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(FinSightBootstrapConfig.class);

    @Test
    void context_shouldBindPipelineProperties() {
        runner.withPropertyValues(
                "pipeline.symbols=NVDA,AMD",
                "pipeline.concurrency=4",
                "pipeline.insight.await-forecast=false",
                "store.dir=" + tempDir.resolve("artifacts"),
                "ai.provider=local"
        ).run(context -> {
            assertNull(context.getStartupFailure());
            PipelineSettings settings = context.getBean(PipelineSettings.class);
            assertEquals(SymbolSet.of("NVDA", "AMD").asList(), settings.symbols.asList());
            assertEquals(4, settings.concurrency);
            assertFalse(settings.insightAwaitForecast);

            ArtifactStore store = context.getBean(ArtifactStore.class);
            assertTrue(store instanceof FileArtifactStore);
            assertEquals(tempDir.resolve("artifacts").toAbsolutePath().normalize(), ((FileArtifactStore) store).root());
            assertNotNull(context.getBean(HybridReadAccessor.class));
        });
    }

    @Test
    void context_shouldFailOnInvalidSettings() {
        runner.withPropertyValues("pipeline.concurrency=0", "ai.provider=local")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }
}

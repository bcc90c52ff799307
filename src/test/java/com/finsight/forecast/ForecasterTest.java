package com.finsight.forecast;

import com.finsight.config.PipelineSettings;
import com.finsight.errors.ForecastError;
import com.finsight.feature.FeatureTransformer;
import com.finsight.model.Direction;
import com.finsight.model.FeatureSet;
import com.finsight.model.ForecastArtifact;
import com.finsight.model.ModelSnapshot;
import com.finsight.support.TestConfigs;
import com.finsight.support.TestSeries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ForecasterTest {
    private static final Instant AS_OF = Instant.parse("2024-06-03T12:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void freshForecastShouldRetrainAndClassifyFromTheSameDelta() throws Exception {
        PipelineSettings settings = TestConfigs.settings(tempDir);
        Forecaster forecaster = forecaster(settings);
        FeatureSet features = features(settings, 120);

        ForecastOutcome outcome = forecaster.forecast(features, AS_OF, Optional.empty());
        ForecastArtifact artifact = outcome.artifact;

        assertTrue(outcome.retrained);
        assertTrue(outcome.trainedSnapshot().isPresent());
        assertEquals(features.lastClose(), artifact.lastClose, 0.0);
        assertEquals(features.lastDate(), artifact.dataAsOf);
        assertEquals(features.sourceFingerprint, artifact.inputFingerprint);
        assertEquals(outcome.snapshot.version, artifact.modelVersion);
        assertEquals(Direction.classify(artifact.predictedClose - artifact.lastClose, settings.deadband), artifact.direction);
        assertEquals((artifact.predictedClose - artifact.lastClose) / artifact.lastClose * 100.0,
                artifact.predictedChangePct, 1e-9);
    }

    @Test
    void recentCompatibleModelShouldBeReused() throws Exception {
        PipelineSettings settings = TestConfigs.settings(tempDir);
        Forecaster forecaster = forecaster(settings);
        FeatureSet features = features(settings, 120);
        ModelSnapshot previous = forecaster.forecast(features, AS_OF, Optional.empty()).snapshot;

        ForecastOutcome again = forecaster.forecast(features, AS_OF.plus(Duration.ofHours(6)), Optional.of(previous));

        assertFalse(again.retrained);
        assertFalse(again.trainedSnapshot().isPresent());
        assertSame(previous, again.snapshot);
        assertEquals(previous.version, again.artifact.modelVersion);
    }

    @Test
    void staleOrIncompatibleModelShouldBeRetrained() throws Exception {
        PipelineSettings settings = TestConfigs.settings(tempDir);
        Forecaster forecaster = forecaster(settings);
        FeatureSet features = features(settings, 120);
        ModelSnapshot previous = forecaster.forecast(features, AS_OF, Optional.empty()).snapshot;

        assertFalse(forecaster.canReuse(previous, features, AS_OF.plus(Duration.ofHours(settings.retrainMaxAgeHours))));
        assertFalse(forecaster.canReuse(previous.toBuilder().lookBack(previous.lookBack + 1).build(), features, AS_OF));
        assertFalse(forecaster.canReuse(previous.toBuilder().modelType("other").build(), features, AS_OF));
        assertFalse(forecaster.canReuse(
                previous.toBuilder().trainedThrough(features.lastDate().minusDays(30)).build(), features, AS_OF));
        assertTrue(forecaster.canReuse(
                previous.toBuilder().trainedThrough(features.lastDate().minusDays(1)).build(), features, AS_OF));
    }

    @Test
    void wideDeadbandShouldForceFlat() throws Exception {
        PipelineSettings settings = TestConfigs.settings(tempDir, Map.of("forecast.deadband", "1000000"));
        ForecastOutcome outcome = forecaster(settings).forecast(features(settings, 120), AS_OF, Optional.empty());

        assertEquals(Direction.FLAT, outcome.artifact.direction);
        assertEquals(1000000.0, outcome.artifact.deadband, 0.0);
    }

    @Test
    void tooFewRowsShouldRaiseForecastError() throws Exception {
        PipelineSettings settings = TestConfigs.settings(tempDir, Map.of("forecast.min_rows", "200"));

        assertThrows(ForecastError.class,
                () -> forecaster(settings).forecast(features(settings, 120), AS_OF, Optional.empty()));
    }

    private static Forecaster forecaster(PipelineSettings settings) {
        return new Forecaster(settings, Forecaster.defaultModel(settings), Clock.fixed(AS_OF, ZoneOffset.UTC));
    }

    private static FeatureSet features(PipelineSettings settings, int bars) throws Exception {
        return new FeatureTransformer(settings.featureSpec).transform(TestSeries.raw("AAPL", bars));
    }
}

package com.finsight.forecast;

import com.finsight.config.PipelineSettings;
import com.finsight.errors.ForecastError;
import com.finsight.model.Direction;
import com.finsight.model.FeatureSet;
import com.finsight.model.ForecastArtifact;
import com.finsight.model.ModelSnapshot;
import com.finsight.model.PriceBar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;

/**
 * 模块说明：Forecaster（class）。
 * 主要职责：决定复用或重训序列模型，并基于同一模型状态一次性给出预测收盘价与方向。
 * 使用建议：不直接访问存储，上一版模型快照由编排器读取后传入。
 */
public final class Forecaster {
    private static final Logger LOG = LogManager.getLogger(Forecaster.class);

    private final SequenceModel model;
    private final int minRows;
    private final double deadband;
    private final Duration maxModelAge;
    private final int maxNewBars;
    private final Clock clock;

    public Forecaster(PipelineSettings settings, SequenceModel model, Clock clock) {
        this.model = model;
        this.minRows = settings.forecastMinRows;
        this.deadband = settings.deadband;
        this.maxModelAge = Duration.ofHours(settings.retrainMaxAgeHours);
        this.maxNewBars = settings.retrainMaxNewBars;
        this.clock = clock;
    }

    public static SequenceModel defaultModel(PipelineSettings settings) {
        return new WindowRegressionModel(settings.lookBack, settings.forecastEpochs, settings.forecastLearningRate);
    }

    public ForecastOutcome forecast(FeatureSet features, Instant asOf, Optional<ModelSnapshot> previous) throws ForecastError {
        double[] closes = features.closes();
        int required = Math.max(minRows, model.lookBack() + 2);
        if (closes.length < required) {
            throw new ForecastError("forecast needs " + required + " cleaned closes, have " + closes.length);
        }

        ModelSnapshot snapshot;
        boolean retrained;
        Optional<ModelSnapshot> reusable = previous == null ? Optional.empty() : previous.filter(p -> canReuse(p, features, asOf));
        if (reusable.isPresent()) {
            snapshot = reusable.get();
            retrained = false;
        } else {
            snapshot = model.train(closes, features.lastDate(), clock.instant());
            retrained = true;
            LOG.info("model trained symbol={} version={} rows={} loss={}",
                    features.symbol, snapshot.version, snapshot.trainingRows, snapshot.finalLoss);
        }
        if (!Double.isFinite(snapshot.finalLoss)) {
            throw new ForecastError("model " + snapshot.version + " has non-finite loss");
        }

        double[] window = Arrays.copyOfRange(closes, closes.length - model.lookBack(), closes.length);
        double predicted = model.predict(snapshot, window);
        double lastClose = closes[closes.length - 1];
        double delta = predicted - lastClose;

        ForecastArtifact artifact = ForecastArtifact.builder()
                .symbol(features.symbol)
                .asOf(asOf)
                .dataAsOf(features.lastDate())
                .lastClose(lastClose)
                .predictedClose(predicted)
                .predictedChangePct(lastClose == 0.0 ? 0.0 : delta / lastClose * 100.0)
                .direction(Direction.classify(delta, deadband))
                .deadband(deadband)
                .modelVersion(snapshot.version)
                .inputFingerprint(features.sourceFingerprint)
                .generatedAt(clock.instant())
                .build();
        return new ForecastOutcome(artifact, snapshot, retrained);
    }

    boolean canReuse(ModelSnapshot previous, FeatureSet features, Instant asOf) {
        if (!model.modelType().equals(previous.modelType) || previous.lookBack != model.lookBack()) {
            return false;
        }
        if (previous.trainedAt == null || previous.trainedThrough == null) {
            return false;
        }
        if (Duration.between(previous.trainedAt, asOf).compareTo(maxModelAge) >= 0) {
            return false;
        }
        int newBars = 0;
        for (PriceBar bar : features.cleanedBars) {
            if (bar.tradeDate.isAfter(previous.trainedThrough)) {
                newBars++;
            }
        }
        return newBars <= maxNewBars;
    }
}

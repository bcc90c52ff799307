package com.finsight.forecast;

import com.finsight.errors.ForecastError;
import com.finsight.model.ArtifactKey;
import com.finsight.model.ModelSnapshot;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;

/**
 * 模块说明：WindowRegressionModel（class）。
 * 主要职责：对 min-max 归一化后的回看窗口做线性回归，用确定性的全批量梯度下降训练。
 * 使用建议：初始权重为等权均线，学习率按窗口长度归一化，保证相同输入得到相同权重。
 */
public final class WindowRegressionModel implements SequenceModel {
    public static final String TYPE = "window-regression";

    private final int lookBack;
    private final int epochs;
    private final double learningRate;

    public WindowRegressionModel(int lookBack, int epochs, double learningRate) {
        if (lookBack < 1 || epochs < 1 || !(learningRate > 0.0)) {
            throw new IllegalArgumentException("invalid model parameters lookBack=" + lookBack
                    + " epochs=" + epochs + " learningRate=" + learningRate);
        }
        this.lookBack = lookBack;
        this.epochs = epochs;
        this.learningRate = learningRate;
    }

    @Override
    public String modelType() {
        return TYPE;
    }

    @Override
    public int lookBack() {
        return lookBack;
    }

    @Override
    public ModelSnapshot train(double[] closes, LocalDate trainedThrough, Instant trainedAt) throws ForecastError {
        if (closes == null || closes.length < lookBack + 2) {
            throw new ForecastError("not enough closes to train: need " + (lookBack + 2)
                    + ", have " + (closes == null ? 0 : closes.length));
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double c : closes) {
            if (!Double.isFinite(c)) {
                throw new ForecastError("non-finite close in training data");
            }
            min = Math.min(min, c);
            max = Math.max(max, c);
        }
        double span = max - min;
        if (span <= 0.0) {
            span = 1.0;
        }
        double[] scaled = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            scaled[i] = (closes[i] - min) / span;
        }

        int samples = closes.length - lookBack;
        double[] weights = new double[lookBack];
        Arrays.fill(weights, 1.0 / lookBack);
        double bias = 0.0;
        double step = learningRate / lookBack;
        double loss = Double.NaN;
        double[] gradW = new double[lookBack];

        for (int epoch = 0; epoch < epochs; epoch++) {
            Arrays.fill(gradW, 0.0);
            double gradB = 0.0;
            double sq = 0.0;
            for (int t = lookBack; t < closes.length; t++) {
                double pred = bias;
                int base = t - lookBack;
                for (int j = 0; j < lookBack; j++) {
                    pred += weights[j] * scaled[base + j];
                }
                double err = pred - scaled[t];
                sq += err * err;
                for (int j = 0; j < lookBack; j++) {
                    gradW[j] += err * scaled[base + j];
                }
                gradB += err;
            }
            loss = sq / samples;
            if (!Double.isFinite(loss)) {
                throw new ForecastError("training diverged at epoch " + epoch);
            }
            double scale = 2.0 / samples;
            for (int j = 0; j < lookBack; j++) {
                weights[j] -= step * scale * gradW[j];
            }
            bias -= step * scale * gradB;
        }
        if (!Double.isFinite(loss) || !Double.isFinite(bias)) {
            throw new ForecastError("training produced non-finite state");
        }

        return ModelSnapshot.builder()
                .modelType(TYPE)
                .version(TYPE + "-" + ArtifactKey.versionFor(trainedAt))
                .lookBack(lookBack)
                .weights(weights)
                .bias(bias)
                .scaleMin(min)
                .scaleMax(min + span)
                .trainedThrough(trainedThrough)
                .trainedAt(trainedAt)
                .trainingRows(closes.length)
                .finalLoss(loss)
                .build();
    }

    @Override
    public double predict(ModelSnapshot snapshot, double[] window) throws ForecastError {
        if (snapshot.weights == null || snapshot.weights.length != window.length) {
            throw new ForecastError("window length " + window.length + " does not match model look-back "
                    + (snapshot.weights == null ? 0 : snapshot.weights.length));
        }
        double span = snapshot.scaleMax - snapshot.scaleMin;
        if (!(span > 0.0)) {
            span = 1.0;
        }
        double y = snapshot.bias;
        for (int j = 0; j < window.length; j++) {
            y += snapshot.weights[j] * ((window[j] - snapshot.scaleMin) / span);
        }
        double predicted = y * span + snapshot.scaleMin;
        if (!Double.isFinite(predicted)) {
            throw new ForecastError("non-finite prediction");
        }
        return predicted;
    }
}

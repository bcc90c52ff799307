package com.finsight.forecast;

import com.finsight.errors.ForecastError;
import com.finsight.model.ModelSnapshot;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Train/predict capability over a close-price sequence. Implementations must be deterministic.
 */
public interface SequenceModel {

    String modelType();

    int lookBack();

    ModelSnapshot train(double[] closes, LocalDate trainedThrough, Instant trainedAt) throws ForecastError;

    /**
     * Predicts the next close from the last {@link #lookBack()} closes.
     */
    double predict(ModelSnapshot snapshot, double[] window) throws ForecastError;
}

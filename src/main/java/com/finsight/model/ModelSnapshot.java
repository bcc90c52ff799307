package com.finsight.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Trained state of a sequence model. Weights are applied to a min-max scaled look-back window.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ModelSnapshot {
    public final String modelType;
    public final String version;
    public final int lookBack;
    public final double[] weights;
    public final double bias;
    public final double scaleMin;
    public final double scaleMax;
    public final LocalDate trainedThrough;
    public final Instant trainedAt;
    public final int trainingRows;
    public final double finalLoss;
}

package com.finsight.insight;

import com.finsight.errors.InsightError;
import com.finsight.model.FeatureSet;
import com.finsight.model.ForecastArtifact;
import com.finsight.model.InsightArtifact;

import java.time.Instant;
import java.util.Optional;

/**
 * Produces short natural-language commentary for one symbol.
 */
public interface InsightGenerator {

    InsightArtifact summarize(FeatureSet features, Optional<ForecastArtifact> forecast, Instant asOf) throws InsightError;

    String sourceModelId();
}

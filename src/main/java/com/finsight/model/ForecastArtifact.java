package com.finsight.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ForecastArtifact {
    public final Symbol symbol;
    public final Instant asOf;
    public final LocalDate dataAsOf;
    public final double lastClose;
    public final double predictedClose;
    public final double predictedChangePct;
    public final Direction direction;
    public final double deadband;
    public final String modelVersion;
    public final String inputFingerprint;
    public final Instant generatedAt;
}

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
public final class InsightArtifact {
    public final Symbol symbol;
    public final Instant asOf;
    public final LocalDate dataAsOf;
    public final String commentary;
    public final Instant generatedAt;
    public final String sourceModelId;
    public final boolean forecastReferenced;
    public final String inputFingerprint;
}

package com.finsight.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures a single pipeline run's stage timings and symbol counts.
 */
public final class RunTelemetry {
    public static final String STEP_FETCH = "FETCH";
    public static final String STEP_TRANSFORM = "TRANSFORM";
    public static final String STEP_FORECAST = "FORECAST";
    public static final String STEP_INSIGHT = "INSIGHT";
    public static final String STEP_COMMIT = "COMMIT";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String runId;
    private final String trigger;
    private final Instant asOf;
    private final Instant startedAt;
    private Instant finishedAt;

    private int symbolsTotal;
    private int errorsTotal;
    private final Map<String, Integer> stateCounts = new LinkedHashMap<>();
    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Integer> causeCounts = new HashMap<>();

    public RunTelemetry(String runId, String trigger, Instant asOf, Instant startedAt) {
        this.runId = blankTo(runId, "unknown");
        this.trigger = blankTo(trigger, "manual");
        this.asOf = asOf;
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
        this.finishedAt = null;
    }

    public synchronized String runId() {
        return runId;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    public synchronized void setSymbolsTotal(int total) {
        this.symbolsTotal = Math.max(0, total);
    }

    /**
     * Adds one stage execution. Stages of different symbols run concurrently, so elapsed
     * time is the sum of per-symbol durations, not wall-clock.
     */
    public synchronized void recordStep(String name, long elapsedMs, boolean ok, String cause) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        stat.count++;
        stat.elapsedMs += Math.max(0L, elapsedMs);
        if (!ok) {
            stat.errorCount++;
            errorsTotal++;
            if (cause != null && !cause.isBlank()) {
                causeCounts.merge(key + ":" + cause.trim(), 1, Integer::sum);
            }
        }
    }

    public synchronized void recordSymbolState(String state) {
        stateCounts.merge(blankTo(state, "UNKNOWN"), 1, Integer::sum);
    }

    public synchronized int stateCount(String state) {
        return stateCounts.getOrDefault(state, 0);
    }

    public synchronized int errorsTotal() {
        return errorsTotal;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.count, stat.elapsedMs, stat.errorCount));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("run_id=").append(runId).append('\n');
        sb.append("trigger=").append(trigger).append('\n');
        sb.append("as_of=").append(asOf == null ? "-" : ISO.format(asOf)).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("symbols_total=").append(symbolsTotal).append('\n');
        for (Map.Entry<String, Integer> entry : stateCounts.entrySet()) {
            sb.append("symbols_").append(entry.getKey().toLowerCase(Locale.ROOT)).append('=').append(entry.getValue()).append('\n');
        }
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s count=%d elapsed_ms=%d err=%d",
                    stat.name,
                    stat.count,
                    stat.elapsedMs,
                    stat.errorCount
            ));
            sb.append('\n');
        }
        if (!causeCounts.isEmpty()) {
            sb.append("causes:\n");
            causeCounts.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> sb.append("  ").append(e.getKey()).append('=').append(e.getValue()).append('\n'));
        }
        return sb.toString().trim();
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long count;
        private long elapsedMs;
        private long errorCount;

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(
            String name,
            long count,
            long elapsedMs,
            long errorCount
    ) {
    }
}

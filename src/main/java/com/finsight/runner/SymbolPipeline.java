package com.finsight.runner;

import com.finsight.config.PipelineSettings;
import com.finsight.core.diagnostics.CauseCode;
import com.finsight.core.diagnostics.Outcome;
import com.finsight.data.MarketDataGateway;
import com.finsight.errors.ForecastError;
import com.finsight.errors.InsightError;
import com.finsight.errors.InsufficientHistoryError;
import com.finsight.errors.NoDataError;
import com.finsight.errors.PipelineStageException;
import com.finsight.errors.StoreError;
import com.finsight.errors.TransientFetchError;
import com.finsight.feature.FeatureTransformer;
import com.finsight.forecast.ForecastOutcome;
import com.finsight.forecast.Forecaster;
import com.finsight.insight.InsightGenerator;
import com.finsight.model.ArtifactKey;
import com.finsight.model.ArtifactKind;
import com.finsight.model.FeatureSet;
import com.finsight.model.ForecastArtifact;
import com.finsight.model.HistoryRange;
import com.finsight.model.InsightArtifact;
import com.finsight.model.ModelSnapshot;
import com.finsight.model.RawSeries;
import com.finsight.model.Symbol;
import com.finsight.store.ArtifactCodec;
import com.finsight.store.ArtifactStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 模块说明：SymbolPipeline（class）。
 * 主要职责：单个标的的阶段编排：抓取、幂等判断、特征转换、预测与点评并行、提交。
 * 使用建议：阶段错误全部在此转换为 StageOutcome，不向外抛出；提交前检查取消状态，保证被取消的标的不推进任何 latest 指针。
 */
final class SymbolPipeline {
    private static final Logger LOG = LogManager.getLogger(SymbolPipeline.class);

    private final PipelineSettings settings;
    private final MarketDataGateway gateway;
    private final FeatureTransformer transformer;
    private final Forecaster forecaster;
    private final InsightGenerator insightGenerator;
    private final ArtifactStore store;
    private final RetryPolicy retryPolicy;
    private final Executor stageExecutor;

    SymbolPipeline(
            PipelineSettings settings,
            MarketDataGateway gateway,
            FeatureTransformer transformer,
            Forecaster forecaster,
            InsightGenerator insightGenerator,
            ArtifactStore store,
            RetryPolicy retryPolicy,
            Executor stageExecutor
    ) {
        this.settings = settings;
        this.gateway = gateway;
        this.transformer = transformer;
        this.forecaster = forecaster;
        this.insightGenerator = insightGenerator;
        this.store = store;
        this.retryPolicy = retryPolicy;
        this.stageExecutor = stageExecutor;
    }

/**
 * 方法说明：execute，负责执行单个标的的完整流水线。
 * 处理流程：各阶段结果追加到 progress，任一终止条件出现时立即返回对应终态。
 */
    SymbolOutcome execute(Symbol symbol, RunRequest request, SymbolProgress progress) {
        try {
            return run(symbol, request, progress);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("symbol={} cancelled during {}", symbol, progress.currentStage());
            return progress.cancelled("cancelled during " + progress.currentStage());
        } catch (RuntimeException e) {
            LOG.error("symbol={} unexpected error", symbol, e);
            progress.add(StageOutcome.failed(progress.currentStage(), CauseCode.RUNTIME_ERROR, describe(e), 1, 0L));
            return progress.finish(SymbolState.FAILED, CauseCode.RUNTIME_ERROR);
        }
    }

    private SymbolOutcome run(Symbol symbol, RunRequest request, SymbolProgress progress) throws InterruptedException {
        Instant asOf = request.asOf;

        // FETCH
        progress.enter(Stage.FETCH);
        Outcome<RawSeries> fetched = fetchWithRetry(symbol, asOf, progress);
        if (!fetched.success) {
            SymbolState state = fetched.causeCode == CauseCode.NO_DATA ? SymbolState.SKIPPED : SymbolState.FAILED;
            return progress.finish(state, fetched.causeCode);
        }
        RawSeries raw = fetched.value;
        String fingerprint = raw.fingerprint();

        // IDEMPOTENCE
        progress.enter(Stage.IDEMPOTENCE);
        long idemStarted = System.nanoTime();
        Freshness freshness = request.forceRefresh ? Freshness.STALE : checkFreshness(symbol, raw, fingerprint);
        if (freshness.forecastCurrent && freshness.insightCurrent) {
            progress.add(new StageOutcome(Stage.IDEMPOTENCE, StageStatus.OK, CauseCode.UNCHANGED,
                    "stored artifacts match input " + shortFp(fingerprint), 1, elapsedMs(idemStarted)));
            return progress.finish(SymbolState.UNCHANGED, CauseCode.UNCHANGED);
        }
        progress.add(StageOutcome.ok(Stage.IDEMPOTENCE, 1, elapsedMs(idemStarted)));

        // TRANSFORM
        progress.enter(Stage.TRANSFORM);
        long transformStarted = System.nanoTime();
        FeatureSet features;
        try {
            features = transformer.transform(raw);
            progress.add(StageOutcome.ok(Stage.TRANSFORM, 1, elapsedMs(transformStarted)));
        } catch (InsufficientHistoryError e) {
            progress.add(StageOutcome.skipped(Stage.TRANSFORM, e.causeCode(), e.getMessage(), 1, elapsedMs(transformStarted)));
            return progress.finish(SymbolState.SKIPPED, e.causeCode());
        }

        // FORECAST + INSIGHT
        progress.enter(Stage.FORECAST);
        StagePair pair = runModelStages(symbol, asOf, features, freshness);
        progress.add(pair.forecastStage);
        progress.add(pair.insightStage);

        // COMMIT
        progress.enter(Stage.COMMIT);
        return commit(symbol, asOf, raw, features, freshness, pair, progress);
    }

    private Outcome<RawSeries> fetchWithRetry(Symbol symbol, Instant asOf, SymbolProgress progress) throws InterruptedException {
        LocalDate end = asOf.atZone(ZoneOffset.UTC).toLocalDate();
        HistoryRange range = HistoryRange.lastDays(end, settings.historyDays);
        long started = System.nanoTime();
        PipelineStageException last = null;
        int attempt = 0;
        while (attempt < retryPolicy.maxAttempts()) {
            attempt++;
            try {
                RawSeries raw = gateway.fetchHistory(symbol, range);
                if (raw.isEmpty()) {
                    throw new NoDataError(gateway.providerId() + " " + symbol.value + ": empty series");
                }
                progress.add(StageOutcome.ok(Stage.FETCH, attempt, elapsedMs(started)));
                return Outcome.success(raw, "fetch");
            } catch (NoDataError e) {
                progress.add(StageOutcome.skipped(Stage.FETCH, CauseCode.NO_DATA, e.getMessage(), attempt, elapsedMs(started)));
                LOG.info("symbol={} skipped: {}", symbol, e.getMessage());
                return Outcome.failure(CauseCode.NO_DATA, "fetch", e.getMessage());
            } catch (TransientFetchError e) {
                last = e;
                if (e.causeCode() == CauseCode.CANCELLED || Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("fetch interrupted");
                }
                LOG.warn("symbol={} fetch attempt {}/{} failed cause={} err={}",
                        symbol, attempt, retryPolicy.maxAttempts(), e.causeCode(), e.getMessage());
                if (attempt < retryPolicy.maxAttempts()) {
                    retryPolicy.pause(attempt);
                }
            }
        }
        CauseCode cause = last == null ? CauseCode.FETCH_FAILED : last.causeCode();
        String message = last == null ? "fetch failed" : last.getMessage();
        progress.add(StageOutcome.failed(Stage.FETCH, cause, message, attempt, elapsedMs(started)));
        return Outcome.failure(cause, "fetch", message);
    }

    private Freshness checkFreshness(Symbol symbol, RawSeries raw, String fingerprint) {
        try {
            Optional<JSONObject> storedRaw = store.get(ArtifactKey.latest(symbol, ArtifactKind.RAW));
            if (storedRaw.isEmpty()) {
                return Freshness.STALE;
            }
            String storedFp = storedRaw.get().optString("fingerprint", "");
            String storedDate = storedRaw.get().optString("last_trade_date", "");
            LocalDate lastTradeDate = raw.lastTradeDate();
            boolean grown = storedDate.isEmpty() || lastTradeDate.isAfter(LocalDate.parse(storedDate));
            if (grown || !storedFp.equals(fingerprint)) {
                return Freshness.STALE;
            }
            Optional<ForecastArtifact> forecast = store.get(ArtifactKey.latest(symbol, ArtifactKind.FORECAST))
                    .map(ArtifactCodec::decodeForecast);
            Optional<InsightArtifact> insight = store.get(ArtifactKey.latest(symbol, ArtifactKind.INSIGHT))
                    .map(ArtifactCodec::decodeInsight);
            boolean forecastCurrent = forecast.isPresent() && fingerprint.equals(forecast.get().inputFingerprint);
            boolean insightCurrent = insight.isPresent() && fingerprint.equals(insight.get().inputFingerprint);
            return new Freshness(true, forecastCurrent, insightCurrent, forecastCurrent ? forecast.get() : null);
        } catch (StoreError | RuntimeException e) {
            LOG.warn("symbol={} idempotence check could not read store, recomputing: {}", symbol, describe(e));
            return Freshness.STALE;
        }
    }

/**
 * 方法说明：runModelStages，负责并行执行预测与点评两个阶段。
 * 处理流程：点评阶段按配置等待预测结果；预测失败不阻塞点评，点评此时不引用预测数值。
 */
    private StagePair runModelStages(Symbol symbol, Instant asOf, FeatureSet features, Freshness freshness) throws InterruptedException {
        long started = System.nanoTime();

        CompletableFuture<StageResult<ForecastOutcome>> forecastFuture;
        if (freshness.forecastCurrent) {
            forecastFuture = CompletableFuture.completedFuture(StageResult.reused());
        } else {
            Optional<ModelSnapshot> previousModel = loadModel(symbol);
            forecastFuture = CompletableFuture.supplyAsync(
                    () -> callForecast(features, asOf, previousModel), stageExecutor);
        }

        CompletableFuture<StageResult<InsightArtifact>> insightFuture;
        if (freshness.insightCurrent) {
            insightFuture = CompletableFuture.completedFuture(StageResult.reused());
        } else if (settings.insightAwaitForecast) {
            insightFuture = forecastFuture.handleAsync(
                    (forecast, err) -> callInsight(features, forecastFor(forecast, err, freshness), asOf), stageExecutor);
        } else {
            insightFuture = CompletableFuture.supplyAsync(
                    () -> callInsight(features, Optional.empty(), asOf), stageExecutor);
        }

        StageResult<ForecastOutcome> forecastResult;
        StageResult<InsightArtifact> insightResult;
        try {
            forecastResult = await(forecastFuture, settings.symbolTimeoutSec, CauseCode.FORECAST_FAILED);
            insightResult = await(insightFuture, settings.aiTimeoutSec, CauseCode.INSIGHT_FAILED);
        } catch (InterruptedException e) {
            forecastFuture.cancel(true);
            insightFuture.cancel(true);
            throw e;
        }

        StageOutcome forecastStage = forecastResult.toStage(Stage.FORECAST, elapsedMs(started));
        StageOutcome insightStage = insightResult.toStage(Stage.INSIGHT, elapsedMs(started));
        return new StagePair(forecastResult, insightResult, forecastStage, insightStage);
    }

    private StageResult<ForecastOutcome> callForecast(FeatureSet features, Instant asOf, Optional<ModelSnapshot> previousModel) {
        long started = System.nanoTime();
        try {
            ForecastOutcome outcome = forecaster.forecast(features, asOf, previousModel);
            return StageResult.ok(outcome, elapsedMs(started));
        } catch (ForecastError e) {
            LOG.warn("symbol={} forecast failed: {}", features.symbol, e.getMessage());
            return StageResult.failed(e.causeCode(), e.getMessage(), elapsedMs(started));
        }
    }

    private StageResult<InsightArtifact> callInsight(FeatureSet features, Optional<ForecastArtifact> forecast, Instant asOf) {
        long started = System.nanoTime();
        try {
            InsightArtifact insight = insightGenerator.summarize(features, forecast, asOf);
            return StageResult.ok(insight, elapsedMs(started));
        } catch (InsightError e) {
            LOG.warn("symbol={} insight failed cause={}: {}", features.symbol, e.causeCode(), e.getMessage());
            return StageResult.failed(e.causeCode(), e.getMessage(), elapsedMs(started));
        }
    }

    private Optional<ForecastArtifact> forecastFor(StageResult<ForecastOutcome> forecast, Throwable err, Freshness freshness) {
        if (err != null || forecast == null) {
            return Optional.empty();
        }
        if (forecast.status == StageStatus.REUSED) {
            return Optional.ofNullable(freshness.currentForecast);
        }
        if (forecast.status == StageStatus.OK && forecast.value != null) {
            return Optional.of(forecast.value.artifact);
        }
        return Optional.empty();
    }

    private <T> StageResult<T> await(CompletableFuture<StageResult<T>> future, int timeoutSec, CauseCode failureCause)
            throws InterruptedException {
        try {
            return future.get(timeoutSec, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return StageResult.failed(CauseCode.TIMEOUT, "timed out after " + timeoutSec + "s", timeoutSec * 1000L);
        } catch (CancellationException e) {
            return StageResult.failed(CauseCode.CANCELLED, "cancelled", 0L);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause()
                    : e.getCause();
            return StageResult.failed(failureCause, describe(cause), 0L);
        }
    }

    private Optional<ModelSnapshot> loadModel(Symbol symbol) {
        try {
            return store.get(ArtifactKey.latest(symbol, ArtifactKind.MODEL)).map(ArtifactCodec::decodeModel);
        } catch (StoreError | RuntimeException e) {
            LOG.warn("symbol={} could not load model snapshot, retraining: {}", symbol, describe(e));
            return Optional.empty();
        }
    }

/**
 * 方法说明：commit，负责写入本次产物并推进 latest 指针。
 * 处理流程：先写全部版本，任何写入失败都不推进指针；全部写入成功后再原子地进入提交态并逐个推进指针。
 */
    private SymbolOutcome commit(
            Symbol symbol,
            Instant asOf,
            RawSeries raw,
            FeatureSet features,
            Freshness freshness,
            StagePair pair,
            SymbolProgress progress
    ) throws InterruptedException {
        long started = System.nanoTime();
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("cancelled before commit");
        }

        Map<ArtifactKind, JSONObject> payloads = new LinkedHashMap<>();
        if (!freshness.rawUnchanged) {
            payloads.put(ArtifactKind.RAW, ArtifactCodec.encodeRaw(raw));
            payloads.put(ArtifactKind.PROCESSED, ArtifactCodec.encodeProcessed(features));
        }
        if (pair.forecast.status == StageStatus.OK) {
            payloads.put(ArtifactKind.FORECAST, ArtifactCodec.encodeForecast(pair.forecast.value.artifact));
            pair.forecast.value.trainedSnapshot()
                    .ifPresent(model -> payloads.put(ArtifactKind.MODEL, ArtifactCodec.encodeModel(symbol, model)));
        }
        if (pair.insight.status == StageStatus.OK) {
            payloads.put(ArtifactKind.INSIGHT, ArtifactCodec.encodeInsight(pair.insight.value));
        }

        String baseVersion = ArtifactKey.versionFor(asOf);
        Map<ArtifactKind, String> written = new EnumMap<>(ArtifactKind.class);
        try {
            for (Map.Entry<ArtifactKind, JSONObject> entry : payloads.entrySet()) {
                String version = store.nextVersion(symbol, entry.getKey(), baseVersion);
                store.put(ArtifactKey.version(symbol, entry.getKey(), version), entry.getValue());
                written.put(entry.getKey(), version);
            }
        } catch (StoreError e) {
            LOG.error("symbol={} commit failed while writing versions, no pointer advanced: {}", symbol, e.getMessage());
            progress.add(StageOutcome.failed(Stage.COMMIT, CauseCode.STORE_ERROR, e.getMessage(), 1, elapsedMs(started)));
            return progress.finish(SymbolState.FAILED, CauseCode.STORE_ERROR);
        }

        if (!progress.beginPointerAdvance()) {
            throw new InterruptedException("cancelled before pointer advance");
        }
        Map<ArtifactKind, String> advanced = new EnumMap<>(ArtifactKind.class);
        try {
            for (Map.Entry<ArtifactKind, String> entry : written.entrySet()) {
                store.advanceLatest(symbol, entry.getKey(), entry.getValue());
                advanced.put(entry.getKey(), entry.getValue());
            }
        } catch (StoreError e) {
            LOG.error("symbol={} pointer advance failed after {}: {}", symbol, advanced.keySet(), e.getMessage());
            progress.add(StageOutcome.failed(Stage.COMMIT, CauseCode.STORE_ERROR,
                    e.getMessage() + " (advanced=" + advanced.keySet() + ")", 1, elapsedMs(started)));
            progress.committed(advanced);
            return progress.finish(SymbolState.FAILED, CauseCode.STORE_ERROR);
        }
        progress.add(StageOutcome.ok(Stage.COMMIT, 1, elapsedMs(started)));
        progress.committed(advanced);

        boolean forecastCurrent = pair.forecast.status == StageStatus.OK || pair.forecast.status == StageStatus.REUSED;
        boolean insightCurrent = pair.insight.status == StageStatus.OK || pair.insight.status == StageStatus.REUSED;
        if (forecastCurrent && insightCurrent) {
            return progress.finish(SymbolState.COMMITTED, CauseCode.NONE);
        }
        CauseCode cause = !forecastCurrent ? pair.forecast.cause : pair.insight.cause;
        if (advanced.isEmpty()) {
            // nothing advanced this run, the stored pointers are unchanged
            LOG.warn("symbol={} no artifact committed, cause={}", symbol, cause);
            return progress.finish(SymbolState.FAILED, cause);
        }
        return progress.finish(SymbolState.PARTIALLY_COMMITTED, cause);
    }

    private static long elapsedMs(long startedNanos) {
        return Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
    }

    private static String shortFp(String fingerprint) {
        return fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
    }

    static String describe(Throwable e) {
        if (e == null) {
            return "unknown error";
        }
        String msg = e.getMessage();
        return msg == null || msg.isBlank() ? e.getClass().getSimpleName() : msg;
    }

    private static final class Freshness {
        static final Freshness STALE = new Freshness(false, false, false, null);

        final boolean rawUnchanged;
        final boolean forecastCurrent;
        final boolean insightCurrent;
        final ForecastArtifact currentForecast;

        Freshness(boolean rawUnchanged, boolean forecastCurrent, boolean insightCurrent, ForecastArtifact currentForecast) {
            this.rawUnchanged = rawUnchanged;
            this.forecastCurrent = forecastCurrent;
            this.insightCurrent = insightCurrent;
            this.currentForecast = currentForecast;
        }
    }

    private static final class StageResult<T> {
        final StageStatus status;
        final T value;
        final CauseCode cause;
        final String message;
        final long elapsedMs;

        private StageResult(StageStatus status, T value, CauseCode cause, String message, long elapsedMs) {
            this.status = status;
            this.value = value;
            this.cause = cause;
            this.message = message;
            this.elapsedMs = elapsedMs;
        }

        static <T> StageResult<T> ok(T value, long elapsedMs) {
            return new StageResult<>(StageStatus.OK, value, CauseCode.NONE, "", elapsedMs);
        }

        static <T> StageResult<T> reused() {
            return new StageResult<>(StageStatus.REUSED, null, CauseCode.NONE, "current for this input", 0L);
        }

        static <T> StageResult<T> failed(CauseCode cause, String message, long elapsedMs) {
            return new StageResult<>(StageStatus.FAILED, null, cause, message, elapsedMs);
        }

        StageOutcome toStage(Stage stage, long fallbackElapsedMs) {
            if (status == StageStatus.REUSED) {
                return StageOutcome.reused(stage, message);
            }
            long elapsed = elapsedMs > 0L ? elapsedMs : fallbackElapsedMs;
            return new StageOutcome(stage, status, cause, message, 1, elapsed);
        }
    }

    private static final class StagePair {
        final StageResult<ForecastOutcome> forecast;
        final StageResult<InsightArtifact> insight;
        final StageOutcome forecastStage;
        final StageOutcome insightStage;

        StagePair(
                StageResult<ForecastOutcome> forecast,
                StageResult<InsightArtifact> insight,
                StageOutcome forecastStage,
                StageOutcome insightStage
        ) {
            this.forecast = forecast;
            this.insight = insight;
            this.forecastStage = forecastStage;
            this.insightStage = insightStage;
        }
    }

    /**
     * Live per-symbol state shared between the worker and the orchestrator's timeout watchdog.
     */
    static final class SymbolProgress {
        private static final int RUNNING = 0;
        private static final int ADVANCING = 1;
        private static final int CANCELLED = 2;

        private final Symbol symbol;
        private final List<StageOutcome> stages = Collections.synchronizedList(new ArrayList<>());
        private final Map<ArtifactKind, String> committed = Collections.synchronizedMap(new EnumMap<>(ArtifactKind.class));
        private final AtomicInteger phase = new AtomicInteger(RUNNING);
        private volatile Stage currentStage = Stage.FETCH;
        private volatile long startedNanos = 0L;

        SymbolProgress(Symbol symbol) {
            this.symbol = symbol;
        }

        void start() {
            startedNanos = System.nanoTime();
        }

        long startedNanos() {
            return startedNanos;
        }

        void enter(Stage stage) {
            currentStage = stage;
        }

        Stage currentStage() {
            return currentStage;
        }

        void add(StageOutcome outcome) {
            stages.add(outcome);
        }

        void committed(Map<ArtifactKind, String> versions) {
            committed.putAll(versions);
        }

        /**
         * Claims the right to advance pointers. Fails once the watchdog has cancelled the symbol.
         */
        boolean beginPointerAdvance() {
            return phase.compareAndSet(RUNNING, ADVANCING);
        }

        /**
         * Marks the symbol cancelled unless pointer advance already started.
         */
        boolean tryCancel() {
            return phase.compareAndSet(RUNNING, CANCELLED);
        }

        SymbolOutcome finish(SymbolState state, CauseCode cause) {
            return new SymbolOutcome(symbol, state, cause, snapshotStages(), snapshotCommitted());
        }

        SymbolOutcome cancelled(String message) {
            List<StageOutcome> out = snapshotStages();
            out.add(StageOutcome.failed(currentStage, CauseCode.CANCELLED, message, 1, 0L));
            return new SymbolOutcome(symbol, SymbolState.FAILED, CauseCode.CANCELLED, out, Map.of());
        }

        private List<StageOutcome> snapshotStages() {
            synchronized (stages) {
                return new ArrayList<>(stages);
            }
        }

        private Map<ArtifactKind, String> snapshotCommitted() {
            synchronized (committed) {
                Map<ArtifactKind, String> copy = new EnumMap<>(ArtifactKind.class);
                copy.putAll(committed);
                return copy;
            }
        }
    }
}

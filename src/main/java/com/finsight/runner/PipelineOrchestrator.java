package com.finsight.runner;

import com.finsight.config.PipelineConfigurationException;
import com.finsight.config.PipelineSettings;
import com.finsight.core.RunTelemetry;
import com.finsight.core.diagnostics.CauseCode;
import com.finsight.data.MarketDataGateway;
import com.finsight.errors.StoreError;
import com.finsight.feature.FeatureTransformer;
import com.finsight.forecast.Forecaster;
import com.finsight.insight.InsightGenerator;
import com.finsight.model.Symbol;
import com.finsight.store.ArtifactStore;
import com.finsight.store.RunLedger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 模块说明：PipelineOrchestrator（class）。
 * 主要职责：按标的并发执行抓取、转换、预测、点评与提交，并汇总为 RunReport 写入运行台账。
 * 使用建议：实例只保存配置与依赖，可被调度器与命令行重复调用；同一标的的两次并发运行按标的串行。
 */
public final class PipelineOrchestrator {
    private static final Logger LOG = LogManager.getLogger(PipelineOrchestrator.class);
    private static final long WATCHDOG_POLL_MS = 200L;

    private final PipelineSettings settings;
    private final MarketDataGateway gateway;
    private final FeatureTransformer transformer;
    private final Forecaster forecaster;
    private final InsightGenerator insightGenerator;
    private final ArtifactStore store;
    private final RunLedger ledger;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final Map<Symbol, ReentrantLock> symbolLocks = new ConcurrentHashMap<>();

    public PipelineOrchestrator(
            PipelineSettings settings,
            MarketDataGateway gateway,
            FeatureTransformer transformer,
            Forecaster forecaster,
            InsightGenerator insightGenerator,
            ArtifactStore store,
            RunLedger ledger,
            RetryPolicy retryPolicy,
            Clock clock
    ) {
        this.settings = settings;
        this.gateway = gateway;
        this.transformer = transformer;
        this.forecaster = forecaster;
        this.insightGenerator = insightGenerator;
        this.store = store;
        this.ledger = ledger;
        this.retryPolicy = retryPolicy;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public PipelineSettings settings() {
        return settings;
    }

/**
 * 方法说明：run，负责执行一次完整运行。
 * 处理流程：校验请求，按并发度提交标的任务，轮询完成队列并对超时任务执行取消，最后写台账与遥测摘要。
 */
    public RunReport run(RunRequest request) {
        if (request == null || request.asOf == null) {
            throw new PipelineConfigurationException("run request requires asOf");
        }
        if (request.symbols == null || request.symbols.isEmpty()) {
            throw new PipelineConfigurationException("run request requires at least one symbol");
        }

        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        List<Symbol> symbols = request.symbols.asList();
        RunTelemetry telemetry = new RunTelemetry(runId, request.trigger, request.asOf, startedAt);
        telemetry.setSymbolsTotal(symbols.size());
        LOG.info("run={} start trigger={} asOf={} symbols={} force={}",
                runId, request.trigger, request.asOf, request.symbols, request.forceRefresh);

        int workers = Math.max(1, Math.min(settings.concurrency, symbols.size()));
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        ExecutorService stagePool = Executors.newFixedThreadPool(Math.max(2, workers * 2));
        SymbolPipeline pipeline = new SymbolPipeline(
                settings, gateway, transformer, forecaster, insightGenerator, store, retryPolicy, stagePool);

        SymbolOutcome[] results = new SymbolOutcome[symbols.size()];
        try {
            ExecutorCompletionService<SymbolOutcome> completion = new ExecutorCompletionService<>(pool);
            Map<Future<SymbolOutcome>, SymbolTask> pending = new HashMap<>();
            for (int i = 0; i < symbols.size(); i++) {
                SymbolTask task = new SymbolTask(i, symbols.get(i), request, pipeline);
                pending.put(completion.submit(task), task);
            }

            long budgetNanos = TimeUnit.SECONDS.toNanos(settings.symbolTimeoutSec);
            while (!pending.isEmpty()) {
                Future<SymbolOutcome> done = completion.poll(WATCHDOG_POLL_MS, TimeUnit.MILLISECONDS);
                if (done != null) {
                    SymbolTask task = pending.remove(done);
                    if (task != null && results[task.index] == null) {
                        results[task.index] = collect(done, task);
                    }
                }
                cancelOverdue(pending, results, budgetNanos);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("run={} interrupted, remaining symbols marked cancelled", runId);
            for (int i = 0; i < results.length; i++) {
                if (results[i] == null) {
                    results[i] = new SymbolPipeline.SymbolProgress(symbols.get(i)).cancelled("run interrupted");
                }
            }
        } finally {
            pool.shutdownNow();
            stagePool.shutdownNow();
        }

        List<SymbolOutcome> outcomes = new ArrayList<>(results.length);
        for (SymbolOutcome outcome : results) {
            outcomes.add(outcome);
            recordTelemetry(telemetry, outcome);
        }
        telemetry.finish();
        RunReport report = new RunReport(runId, request.asOf, request.forceRefresh, request.trigger,
                startedAt, clock.instant(), outcomes);

        try {
            ledger.record(report);
        } catch (StoreError e) {
            LOG.warn("run={} could not write run ledger: {}", runId, e.getMessage());
        }
        LOG.info(telemetry.getSummary());
        LOG.info("run={} finished status={} outcomes={}", runId, report.status(), report.outcomes);
        return report;
    }

    private SymbolOutcome collect(Future<SymbolOutcome> done, SymbolTask task) throws InterruptedException {
        try {
            return done.get();
        } catch (CancellationException e) {
            return task.progress.cancelled("cancelled");
        } catch (ExecutionException e) {
            LOG.error("symbol={} task failed", task.symbol, e.getCause());
            return task.progress.finish(SymbolState.FAILED, CauseCode.RUNTIME_ERROR);
        }
    }

    private void cancelOverdue(Map<Future<SymbolOutcome>, SymbolTask> pending, SymbolOutcome[] results, long budgetNanos) {
        long now = System.nanoTime();
        List<Future<SymbolOutcome>> expired = new ArrayList<>();
        for (Map.Entry<Future<SymbolOutcome>, SymbolTask> entry : pending.entrySet()) {
            SymbolTask task = entry.getValue();
            long started = task.progress.startedNanos();
            if (started == 0L || now - started <= budgetNanos) {
                continue;
            }
            if (task.progress.tryCancel()) {
                LOG.warn("symbol={} exceeded {}s budget during {}, cancelling",
                        task.symbol, settings.symbolTimeoutSec, task.progress.currentStage());
                entry.getKey().cancel(true);
                results[task.index] = task.progress.cancelled(
                        "exceeded " + settings.symbolTimeoutSec + "s during " + task.progress.currentStage());
                expired.add(entry.getKey());
            }
        }
        for (Future<SymbolOutcome> future : expired) {
            pending.remove(future);
        }
    }

    private void recordTelemetry(RunTelemetry telemetry, SymbolOutcome outcome) {
        for (StageOutcome stage : outcome.stages) {
            if (stage.status == StageStatus.REUSED) {
                continue;
            }
            telemetry.recordStep(stage.stage.name(), stage.elapsedMs,
                    stage.status != StageStatus.FAILED, stage.cause.name());
        }
        telemetry.recordSymbolState(outcome.state.name());
    }

    private ReentrantLock lockFor(Symbol symbol) {
        return symbolLocks.computeIfAbsent(symbol, s -> new ReentrantLock());
    }

    private final class SymbolTask implements Callable<SymbolOutcome> {
        private final int index;
        private final Symbol symbol;
        private final RunRequest request;
        private final SymbolPipeline pipeline;
        private final SymbolPipeline.SymbolProgress progress;

        private SymbolTask(int index, Symbol symbol, RunRequest request, SymbolPipeline pipeline) {
            this.index = index;
            this.symbol = symbol;
            this.request = request;
            this.pipeline = pipeline;
            this.progress = new SymbolPipeline.SymbolProgress(symbol);
        }

        @Override
        public SymbolOutcome call() throws InterruptedException {
            ReentrantLock lock = lockFor(symbol);
            lock.lockInterruptibly();
            try {
                progress.start();
                String prev = Thread.currentThread().getName();
                Thread.currentThread().setName("finsight-" + symbol.value);
                try {
                    SymbolOutcome outcome = pipeline.execute(symbol, request, progress);
                    LOG.info("symbol={} state={} cause={}", symbol, outcome.state, outcome.cause);
                    return outcome;
                } finally {
                    Thread.currentThread().setName(prev);
                }
            } finally {
                lock.unlock();
            }
        }
    }
}

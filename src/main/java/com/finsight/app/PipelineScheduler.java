package com.finsight.app;

import com.finsight.model.SymbolSet;
import com.finsight.news.NewsSentimentJob;
import com.finsight.runner.PipelineOrchestrator;
import com.finsight.runner.RunReport;
import com.finsight.runner.RunRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 模块说明：PipelineScheduler（class）。
 * 主要职责：按固定间隔触发编排器，每次以窗口下界作为 asOf，使同一窗口内的重复触发保持幂等。
 * 使用建议：单次触发失败只记录日志，循环继续；线程中断时退出并返回 130。
 */
public final class PipelineScheduler {
    private static final Logger LOG = LogManager.getLogger(PipelineScheduler.class);
    private static final long SLEEP_CHUNK_MS = 30_000L;

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final PipelineOrchestrator orchestrator;
    private final SymbolSet symbols;
    private final Duration interval;
    private final Clock clock;
    private final Sleeper sleeper;
    private final NewsSentimentJob newsJob;

    public PipelineScheduler(PipelineOrchestrator orchestrator, SymbolSet symbols, Duration interval, Clock clock, Sleeper sleeper) {
        this(orchestrator, null, symbols, interval, clock, sleeper);
    }

    /**
     * newsJob may be null; when set it runs after every pipeline tick for the same window.
     */
    public PipelineScheduler(
            PipelineOrchestrator orchestrator,
            NewsSentimentJob newsJob,
            SymbolSet symbols,
            Duration interval,
            Clock clock,
            Sleeper sleeper
    ) {
        this.orchestrator = orchestrator;
        this.newsJob = newsJob;
        this.symbols = symbols;
        this.interval = interval;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.sleeper = sleeper == null ? Thread::sleep : sleeper;
    }

/**
 * 方法说明：runLoop，负责持续调度。
 * 处理流程：启动即执行当前窗口，然后睡眠到下一个窗口边界；maxTicks 大于 0 时执行指定次数后返回。
 */
    public int runLoop(int maxTicks) {
        LOG.info("scheduler started interval={} symbols={}", interval, symbols);
        int ticks = 0;
        while (maxTicks <= 0 || ticks < maxTicks) {
            tick();
            ticks++;
            if (maxTicks > 0 && ticks >= maxTicks) {
                break;
            }
            Instant next = AsOfWindow.next(clock.instant(), interval);
            LOG.info("next run at {}", next);
            if (!sleepUntil(next)) {
                LOG.warn("scheduler interrupted, stopping");
                return 130;
            }
        }
        return 0;
    }

    /**
     * Runs the current window once. Returns null when the run itself threw.
     */
    public RunReport tick() {
        Instant asOf = AsOfWindow.floor(clock.instant(), interval);
        RunReport report;
        try {
            report = orchestrator.run(new RunRequest(symbols, asOf, false, "schedule"));
            LOG.info("scheduled run asOf={} status={}", asOf, report.status());
        } catch (RuntimeException e) {
            LOG.error("scheduled run asOf={} failed: {}", asOf, e.getMessage(), e);
            report = null;
        }
        refreshNews(asOf);
        return report;
    }

    private void refreshNews(Instant asOf) {
        if (newsJob == null || Thread.currentThread().isInterrupted()) {
            return;
        }
        try {
            newsJob.run(symbols, asOf);
        } catch (RuntimeException e) {
            LOG.error("news refresh asOf={} failed: {}", asOf, e.getMessage(), e);
        }
    }

    private boolean sleepUntil(Instant next) {
        while (true) {
            long millis = Duration.between(clock.instant(), next).toMillis();
            if (millis <= 0) {
                return true;
            }
            try {
                sleeper.sleep(Math.min(SLEEP_CHUNK_MS, millis));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}

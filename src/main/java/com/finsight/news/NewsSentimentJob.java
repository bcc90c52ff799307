package com.finsight.news;

import com.finsight.data.HeadlineSource;
import com.finsight.errors.NoDataError;
import com.finsight.errors.StoreError;
import com.finsight.errors.TransientFetchError;
import com.finsight.model.ArtifactKey;
import com.finsight.model.ArtifactKind;
import com.finsight.model.NewsItem;
import com.finsight.model.NewsSentiment;
import com.finsight.model.ScoredHeadline;
import com.finsight.model.Symbol;
import com.finsight.model.SymbolSet;
import com.finsight.runner.SymbolState;
import com.finsight.store.ArtifactCodec;
import com.finsight.store.ArtifactStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 模块说明：NewsSentimentJob（class）。
 * 主要职责：逐个标的抓取最新标题、打分并写入 NEWS 产物，推进 latest 指针。
 * 使用建议：尽力而为，单个标的失败只记日志，不影响价格流水线的运行状态；标题未变化时不写新版本。
 */
public final class NewsSentimentJob {
    private static final Logger LOG = LogManager.getLogger(NewsSentimentJob.class);

    private final HeadlineSource source;
    private final HeadlineSentimentScorer scorer;
    private final ArtifactStore store;
    private final int limit;
    private final Clock clock;

    public NewsSentimentJob(HeadlineSource source, HeadlineSentimentScorer scorer, ArtifactStore store, int limit, Clock clock) {
        this.source = source;
        this.scorer = scorer;
        this.store = store;
        this.limit = Math.max(1, limit);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Map<Symbol, SymbolState> run(SymbolSet symbols, Instant asOf) {
        Map<Symbol, SymbolState> out = new LinkedHashMap<>();
        for (Symbol symbol : symbols) {
            if (Thread.currentThread().isInterrupted()) {
                LOG.warn("news job interrupted before symbol={}", symbol);
                break;
            }
            out.put(symbol, runSymbol(symbol, asOf));
        }
        LOG.info("news sentiment asOf={} results={}", asOf, out);
        return out;
    }

    SymbolState runSymbol(Symbol symbol, Instant asOf) {
        List<NewsItem> items;
        try {
            items = source.fetchHeadlines(symbol, limit);
        } catch (NoDataError e) {
            LOG.warn("symbol={} no news found: {}", symbol, e.getMessage());
            return SymbolState.SKIPPED;
        } catch (TransientFetchError e) {
            LOG.warn("symbol={} news fetch failed cause={}: {}", symbol, e.causeCode(), e.getMessage());
            return SymbolState.FAILED;
        }

        List<ScoredHeadline> scored = new ArrayList<>();
        for (NewsItem item : items.subList(0, Math.min(limit, items.size()))) {
            scored.add(scorer.score(item));
        }
        NewsSentiment news = new NewsSentiment(symbol, asOf, clock.instant(), source.sourceId(), scored);

        try {
            Optional<JSONObject> stored = store.get(ArtifactKey.latest(symbol, ArtifactKind.NEWS));
            if (stored.isPresent() && news.fingerprint().equals(stored.get().optString("fingerprint", ""))) {
                LOG.debug("symbol={} headlines unchanged", symbol);
                return SymbolState.UNCHANGED;
            }
            String version = store.nextVersion(symbol, ArtifactKind.NEWS, ArtifactKey.versionFor(asOf));
            store.put(ArtifactKey.version(symbol, ArtifactKind.NEWS, version), ArtifactCodec.encodeNews(news));
            store.advanceLatest(symbol, ArtifactKind.NEWS, version);
            LOG.info("symbol={} news committed version={} headlines={} avg={} label={}",
                    symbol, version, scored.size(), String.format(Locale.US, "%.2f", news.averageScore()), news.overallLabel());
            return SymbolState.COMMITTED;
        } catch (StoreError e) {
            LOG.error("symbol={} news commit failed: {}", symbol, e.getMessage());
            return SymbolState.FAILED;
        }
    }
}

package com.finsight.view;

import com.finsight.errors.StoreError;
import com.finsight.model.ArtifactKey;
import com.finsight.model.ArtifactKind;
import com.finsight.model.FeatureRow;
import com.finsight.model.FeatureSet;
import com.finsight.model.ForecastArtifact;
import com.finsight.model.NewsSentiment;
import com.finsight.model.PriceBar;
import com.finsight.model.ScoredHeadline;
import com.finsight.model.Symbol;
import com.finsight.model.SymbolSet;
import com.finsight.store.ArtifactCodec;
import com.finsight.store.ArtifactReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 模块说明：ChatContextAssembler（class）。
 * 主要职责：为对话助手拼装单个标的的上下文文本：当前价格、支撑阻力、趋势、近期特征行、缓存预测、新闻情绪以及其他标的对比。
 * 使用建议：只读，不触发流水线；缺失的组件在文本中显式说明。
 */
public final class ChatContextAssembler {
    private static final Logger LOG = LogManager.getLogger(ChatContextAssembler.class);
    private static final int TREND_SMA = 20;

    private final ArtifactReader reader;
    private final HybridReadAccessor accessor;
    private final SymbolSet universe;
    private final int supportWindow;
    private final int recentRows;
    private final int newsItems;

    public ChatContextAssembler(
            ArtifactReader reader,
            HybridReadAccessor accessor,
            SymbolSet universe,
            int supportWindow,
            int recentRows,
            int newsItems
    ) {
        this.reader = reader;
        this.accessor = accessor;
        this.universe = universe;
        this.supportWindow = Math.max(1, supportWindow);
        this.recentRows = Math.max(1, recentRows);
        this.newsItems = Math.max(0, newsItems);
    }

    public String assemble(Symbol symbol) {
        MarketView view = accessor.getView(symbol);
        Optional<FeatureSet> processed = readProcessed(symbol);

        StringBuilder sb = new StringBuilder(1024);
        sb.append("Symbol: ").append(symbol.value).append('\n');
        if (view.price != null) {
            sb.append(String.format(Locale.US, "Current price: $%.2f (%s)", view.price, view.freshness));
            if (view.stale) {
                sb.append(" - ").append(view.notice);
            }
            sb.append('\n');
        } else {
            sb.append("Current price: unavailable - ").append(view.notice).append('\n');
        }

        if (processed.isPresent() && !processed.get().rows.isEmpty()) {
            FeatureSet set = processed.get();
            appendLevels(sb, set);
            appendTrend(sb, set);
            appendRecentRows(sb, set);
        } else {
            sb.append("Technical data: not available yet\n");
        }

        Optional<ForecastArtifact> forecast = view.forecast();
        if (forecast.isPresent()) {
            ForecastArtifact f = forecast.get();
            sb.append(String.format(Locale.US, "Forecast for next session: $%.2f (%s, %+.2f%%), model %s, data as of %s%n",
                    f.predictedClose, f.direction, f.predictedChangePct, f.modelVersion, f.dataAsOf));
        } else {
            sb.append("Forecast: none committed\n");
        }
        view.insight().ifPresent(i -> sb.append("Latest commentary: ").append(i.commentary).append('\n'));
        appendNews(sb, symbol);

        appendComparison(sb, symbol);
        return sb.toString().trim();
    }

    private void appendLevels(StringBuilder sb, FeatureSet set) {
        List<PriceBar> bars = set.cleanedBars;
        int from = Math.max(0, bars.size() - supportWindow);
        double support = Double.POSITIVE_INFINITY;
        double resistance = Double.NEGATIVE_INFINITY;
        for (PriceBar bar : bars.subList(from, bars.size())) {
            if (Double.isFinite(bar.low)) {
                support = Math.min(support, bar.low);
            }
            if (Double.isFinite(bar.high)) {
                resistance = Math.max(resistance, bar.high);
            }
        }
        if (Double.isFinite(support) && Double.isFinite(resistance)) {
            sb.append(String.format(Locale.US, "Support (%d-day low): $%.2f | Resistance (%d-day high): $%.2f%n",
                    bars.size() - from, support, bars.size() - from, resistance));
        }
    }

    private void appendTrend(StringBuilder sb, FeatureSet set) {
        FeatureRow last = set.lastRow();
        if (!last.sma.containsKey(TREND_SMA)) {
            return;
        }
        double sma = last.sma(TREND_SMA);
        String trend = last.close >= sma ? "BULLISH" : "BEARISH";
        sb.append(String.format(Locale.US, "Trend: %s (close $%.2f vs SMA%d $%.2f)%n", trend, last.close, TREND_SMA, sma));
    }

    private void appendRecentRows(StringBuilder sb, FeatureSet set) {
        sb.append("Recent data:\n");
        for (FeatureRow row : set.recentRows(recentRows)) {
            sb.append(String.format(Locale.US, "  %s close=%.2f return=%+.2f%% rsi=%.1f volatility=%.2f%% volume=%,d%n",
                    row.date, row.close, row.returnPct, row.rsi, row.volatility, Math.round(row.volume)));
        }
    }

    private void appendNews(StringBuilder sb, Symbol symbol) {
        if (newsItems == 0) {
            return;
        }
        Optional<NewsSentiment> news;
        try {
            news = reader.get(ArtifactKey.latest(symbol, ArtifactKind.NEWS)).map(ArtifactCodec::decodeNews);
        } catch (StoreError | RuntimeException e) {
            LOG.warn("symbol={} could not read news sentiment for chat context: {}", symbol, e.getMessage());
            return;
        }
        if (news.isEmpty() || news.get().headlines.isEmpty()) {
            return;
        }
        NewsSentiment n = news.get();
        sb.append(String.format(Locale.US, "News sentiment: %s (avg %+.2f over %d headlines, as of %s)%n",
                n.overallLabel(), n.averageScore(), n.headlines.size(), n.asOf));
        for (ScoredHeadline h : n.top(newsItems)) {
            sb.append(String.format(Locale.US, "- [%s] %s (score %+.2f)%n", h.label, h.item.title, h.score));
        }
    }

    private void appendComparison(StringBuilder sb, Symbol symbol) {
        StringBuilder line = new StringBuilder();
        for (Symbol other : universe) {
            if (other.equals(symbol)) {
                continue;
            }
            Optional<FeatureSet> set = readProcessed(other);
            if (set.isEmpty() || set.get().rows.isEmpty()) {
                continue;
            }
            FeatureRow last = set.get().lastRow();
            if (line.length() > 0) {
                line.append(", ");
            }
            line.append(String.format(Locale.US, "%s: $%.2f (%+.2f%%)", other.value, last.close, last.returnPct));
        }
        if (line.length() > 0) {
            sb.append("Other symbols: ").append(line).append('\n');
        }
    }

    private Optional<FeatureSet> readProcessed(Symbol symbol) {
        try {
            return reader.get(ArtifactKey.latest(symbol, ArtifactKind.PROCESSED)).map(ArtifactCodec::decodeProcessed);
        } catch (StoreError | RuntimeException e) {
            LOG.warn("symbol={} could not read processed series for chat context: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }
}

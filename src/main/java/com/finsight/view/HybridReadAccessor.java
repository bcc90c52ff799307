package com.finsight.view;

import com.finsight.config.PipelineSettings;
import com.finsight.data.MarketDataGateway;
import com.finsight.errors.NoDataError;
import com.finsight.errors.StoreError;
import com.finsight.errors.TransientFetchError;
import com.finsight.model.ArtifactKey;
import com.finsight.model.ArtifactKind;
import com.finsight.model.FeatureSet;
import com.finsight.model.ForecastArtifact;
import com.finsight.model.InsightArtifact;
import com.finsight.model.Quote;
import com.finsight.model.Symbol;
import com.finsight.store.ArtifactCodec;
import com.finsight.store.ArtifactReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * 模块说明：HybridReadAccessor（class）。
 * 主要职责：为面板读取单个标的：实时报价优先，失败时回退到最近一次已提交产物中的收盘价，并按状态机给出新鲜度。
 * 使用建议：只持有只读 ArtifactReader，不推进任何指针；存储读取失败时对应组件视为缺失。
 */
public final class HybridReadAccessor {
    private static final Logger LOG = LogManager.getLogger(HybridReadAccessor.class);

    private final ArtifactReader reader;
    private final MarketDataGateway gateway;
    private final long cachedFreshMaxAgeSec;
    private final long quoteCacheTtlSec;
    private final Clock clock;
    private final Map<Symbol, QuoteEntry> quoteCache = new ConcurrentHashMap<>();

    public HybridReadAccessor(ArtifactReader reader, MarketDataGateway gateway, PipelineSettings settings, Clock clock) {
        this.reader = reader;
        this.gateway = gateway;
        this.cachedFreshMaxAgeSec = settings.cachedFreshMaxAgeSec;
        this.quoteCacheTtlSec = settings.quoteCacheTtlSec;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

/**
 * 方法说明：getView，负责组装单个标的的面板视图。
 * 处理流程：读取最新预测与点评，尝试实时报价；报价失败时从预测或特征集中取较新的收盘价作为缓存价格。
 */
    public MarketView getView(Symbol symbol) {
        Instant now = clock.instant();
        Optional<ForecastArtifact> forecast = readLatest(symbol, ArtifactKind.FORECAST, ArtifactCodec::decodeForecast);
        Optional<InsightArtifact> insight = readLatest(symbol, ArtifactKind.INSIGHT, ArtifactCodec::decodeInsight);
        Long forecastAge = forecast.map(f -> ageSeconds(f.generatedAt, now)).orElse(null);
        Long insightAge = insight.map(i -> ageSeconds(i.generatedAt, now)).orElse(null);

        MarketView.MarketViewBuilder view = MarketView.builder()
                .symbol(symbol)
                .forecast(forecast.orElse(null))
                .forecastStalenessSeconds(forecastAge)
                .insight(insight.orElse(null))
                .insightStalenessSeconds(insightAge)
                .generatedAt(now);

        Optional<Quote> quote = liveQuote(symbol, now);
        if (quote.isPresent()) {
            // a quote served from the TTL cache ages like any other price
            return view.freshness(FreshnessState.LIVE)
                    .price(quote.get().price)
                    .priceTimestamp(quote.get().timestamp)
                    .priceStalenessSeconds(ageSeconds(quote.get().timestamp, now))
                    .stale(FreshnessState.LIVE.isStale())
                    .notice("")
                    .build();
        }

        Optional<CachedClose> cached = cachedClose(symbol, forecast);
        Long cachedAge = cached.map(c -> ageSeconds(c.asOf, now)).orElse(null);
        FreshnessState state = FreshnessState.resolve(false, cachedAge, cachedFreshMaxAgeSec);
        if (state == FreshnessState.UNAVAILABLE) {
            return view.freshness(state)
                    .stale(state.isStale())
                    .notice("live price unavailable, no cached data")
                    .build();
        }
        return view.freshness(state)
                .price(cached.get().price)
                .priceTimestamp(cached.get().asOf)
                .priceStalenessSeconds(cachedAge)
                .stale(state.isStale())
                .notice("live price unavailable, showing cached data as of " + cached.get().asOf)
                .build();
    }

    public void clearQuoteCache() {
        quoteCache.clear();
    }

    private Optional<Quote> liveQuote(Symbol symbol, Instant now) {
        QuoteEntry hit = quoteCache.get(symbol);
        if (hit != null && hit.expiresAt.isAfter(now)) {
            return Optional.of(hit.quote);
        }
        try {
            Quote quote = gateway.fetchQuote(symbol);
            if (!Double.isFinite(quote.price) || quote.price <= 0.0) {
                LOG.warn("symbol={} live quote unusable: {}", symbol, quote.price);
                return Optional.empty();
            }
            quoteCache.put(symbol, new QuoteEntry(quote, now.plus(Duration.ofSeconds(quoteCacheTtlSec))));
            return Optional.of(quote);
        } catch (TransientFetchError | NoDataError e) {
            LOG.warn("symbol={} live quote unavailable cause={}: {}", symbol, e.causeCode(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<CachedClose> cachedClose(Symbol symbol, Optional<ForecastArtifact> forecast) {
        Optional<CachedClose> fromForecast = forecast.map(f -> new CachedClose(f.lastClose, f.generatedAt));
        Optional<CachedClose> fromProcessed = processedClose(symbol);
        if (fromForecast.isEmpty()) {
            return fromProcessed;
        }
        if (fromProcessed.isPresent() && fromProcessed.get().asOf.isAfter(fromForecast.get().asOf)) {
            return fromProcessed;
        }
        return fromForecast;
    }

    private Optional<CachedClose> processedClose(Symbol symbol) {
        try {
            Optional<String> version = reader.latestVersion(symbol, ArtifactKind.PROCESSED);
            if (version.isEmpty()) {
                return Optional.empty();
            }
            Optional<JSONObject> payload = reader.get(ArtifactKey.version(symbol, ArtifactKind.PROCESSED, version.get()));
            if (payload.isEmpty()) {
                return Optional.empty();
            }
            FeatureSet set = ArtifactCodec.decodeProcessed(payload.get());
            if (set.rows.isEmpty()) {
                return Optional.empty();
            }
            Instant committedAsOf = ArtifactKey.asOfOf(version.get()).orElse(Instant.EPOCH);
            return Optional.of(new CachedClose(set.lastClose(), committedAsOf));
        } catch (StoreError | RuntimeException e) {
            LOG.warn("symbol={} could not read processed series: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    private <T> Optional<T> readLatest(Symbol symbol, ArtifactKind kind, Function<JSONObject, T> decoder) {
        try {
            return reader.get(ArtifactKey.latest(symbol, kind)).map(decoder);
        } catch (StoreError | RuntimeException e) {
            LOG.warn("symbol={} could not read latest {}: {}", symbol, kind.segment(), e.getMessage());
            return Optional.empty();
        }
    }

    private static long ageSeconds(Instant generatedAt, Instant now) {
        if (generatedAt == null) {
            return 0L;
        }
        return Math.max(0L, Duration.between(generatedAt, now).getSeconds());
    }

    private static final class CachedClose {
        private final double price;
        private final Instant asOf;

        private CachedClose(double price, Instant asOf) {
            this.price = price;
            this.asOf = asOf;
        }
    }

    private static final class QuoteEntry {
        private final Quote quote;
        private final Instant expiresAt;

        private QuoteEntry(Quote quote, Instant expiresAt) {
            this.quote = quote;
            this.expiresAt = expiresAt;
        }
    }
}

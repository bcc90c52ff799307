package com.finsight.view;

import com.finsight.feature.FeatureTransformer;
import com.finsight.model.ArtifactKey;
import com.finsight.model.ArtifactKind;
import com.finsight.model.Direction;
import com.finsight.model.FeatureSet;
import com.finsight.model.FeatureSpec;
import com.finsight.model.ForecastArtifact;
import com.finsight.model.InsightArtifact;
import com.finsight.model.NewsSentiment;
import com.finsight.model.NewsItem;
import com.finsight.model.PriceBar;
import com.finsight.model.ScoredHeadline;
import com.finsight.model.Symbol;
import com.finsight.news.HeadlineSentimentScorer;
import com.finsight.store.ArtifactCodec;
import com.finsight.store.ArtifactStore;
import com.finsight.support.TestSeries;
import org.json.JSONObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

final class ViewFixtures {
    private ViewFixtures() {
    }

    static FeatureSet commitProcessed(ArtifactStore store, String symbol, List<PriceBar> bars, Instant asOf) throws Exception {
        FeatureSet set = new FeatureTransformer(FeatureSpec.defaults()).transform(TestSeries.raw(symbol, bars));
        commit(store, set.symbol, ArtifactKind.PROCESSED, asOf, ArtifactCodec.encodeProcessed(set));
        return set;
    }

    static ForecastArtifact commitForecast(ArtifactStore store, FeatureSet set, Instant asOf, Instant generatedAt) throws Exception {
        ForecastArtifact forecast = ForecastArtifact.builder()
                .symbol(set.symbol)
                .asOf(asOf)
                .dataAsOf(set.lastDate())
                .lastClose(set.lastClose())
                .predictedClose(set.lastClose() + 1.5)
                .predictedChangePct(1.5 / set.lastClose() * 100.0)
                .direction(Direction.UP)
                .deadband(0.5)
                .modelVersion("window-regression-" + ArtifactKey.versionFor(asOf))
                .inputFingerprint(set.sourceFingerprint)
                .generatedAt(generatedAt)
                .build();
        commit(store, set.symbol, ArtifactKind.FORECAST, asOf, ArtifactCodec.encodeForecast(forecast));
        return forecast;
    }

    static InsightArtifact commitInsight(ArtifactStore store, FeatureSet set, Instant asOf, String commentary) throws Exception {
        InsightArtifact insight = InsightArtifact.builder()
                .symbol(set.symbol)
                .asOf(asOf)
                .dataAsOf(set.lastDate())
                .commentary(commentary)
                .generatedAt(asOf)
                .sourceModelId("local-template")
                .forecastReferenced(true)
                .inputFingerprint(set.sourceFingerprint)
                .build();
        commit(store, set.symbol, ArtifactKind.INSIGHT, asOf, ArtifactCodec.encodeInsight(insight));
        return insight;
    }

    static NewsSentiment commitNews(ArtifactStore store, String symbol, Instant asOf, List<String> titles) throws Exception {
        HeadlineSentimentScorer scorer = new HeadlineSentimentScorer();
        List<ScoredHeadline> scored = new ArrayList<>();
        for (int i = 0; i < titles.size(); i++) {
            NewsItem item = new NewsItem(titles.get(i), "https://example.com/" + i, "Example Wire", asOf.minusSeconds(600L * i));
            scored.add(scorer.score(item));
        }
        NewsSentiment news = new NewsSentiment(Symbol.of(symbol), asOf, asOf, "test", scored);
        commit(store, news.symbol, ArtifactKind.NEWS, asOf, ArtifactCodec.encodeNews(news));
        return news;
    }

    private static void commit(ArtifactStore store, Symbol symbol, ArtifactKind kind, Instant asOf, JSONObject payload) throws Exception {
        String version = store.nextVersion(symbol, kind, ArtifactKey.versionFor(asOf));
        store.put(ArtifactKey.version(symbol, kind, version), payload);
        store.advanceLatest(symbol, kind, version);
    }
}

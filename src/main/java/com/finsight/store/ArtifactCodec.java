package com.finsight.store;

import com.finsight.model.ArtifactKind;
import com.finsight.model.Direction;
import com.finsight.model.FeatureRow;
import com.finsight.model.FeatureSet;
import com.finsight.model.FeatureSpec;
import com.finsight.model.ForecastArtifact;
import com.finsight.model.InsightArtifact;
import com.finsight.model.ModelSnapshot;
import com.finsight.model.NewsItem;
import com.finsight.model.NewsSentiment;
import com.finsight.model.PriceBar;
import com.finsight.model.RawSeries;
import com.finsight.model.ScoredHeadline;
import com.finsight.model.Symbol;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：ArtifactCodec（class）。
 * 主要职责：各类产物与 org.json 载荷之间的编解码，载荷携带 schema 字段 finsight.<kind>.v1。
 * 使用建议：非有限数值编码为 null，解码时还原为 NaN；schema 不匹配视为数据损坏并抛出 IllegalArgumentException。
 */
public final class ArtifactCodec {
    public static final String SCHEMA = "schema";

    private ArtifactCodec() {
    }

    public static JSONObject encodeRaw(RawSeries raw) {
        JSONObject obj = header(ArtifactKind.RAW, raw.symbol);
        obj.put("source", raw.source);
        obj.put("fetched_at", raw.fetchedAt.toString());
        obj.put("fingerprint", raw.fingerprint());
        obj.put("last_trade_date", raw.lastTradeDate() == null ? JSONObject.NULL : raw.lastTradeDate().toString());
        obj.put("bars", encodeBars(raw.bars));
        return obj;
    }

    public static RawSeries decodeRaw(JSONObject obj) {
        expect(obj, ArtifactKind.RAW);
        return new RawSeries(
                Symbol.of(obj.getString("symbol")),
                decodeBars(obj.getJSONArray("bars")),
                Instant.parse(obj.getString("fetched_at")),
                obj.optString("source", "")
        );
    }

    public static JSONObject encodeProcessed(FeatureSet set) {
        JSONObject obj = header(ArtifactKind.PROCESSED, set.symbol);
        obj.put("source_fingerprint", set.sourceFingerprint);
        JSONObject spec = new JSONObject();
        spec.put("sma_windows", new JSONArray(set.spec.smaWindows));
        spec.put("volatility_window", set.spec.volatilityWindow);
        spec.put("rsi_period", set.spec.rsiPeriod);
        spec.put("momentum_period", set.spec.momentumPeriod);
        obj.put("spec", spec);
        obj.put("bars", encodeBars(set.cleanedBars));
        JSONArray rows = new JSONArray();
        for (FeatureRow row : set.rows) {
            JSONObject r = new JSONObject();
            r.put("date", row.date.toString());
            putNumber(r, "close", row.close);
            putNumber(r, "volume", row.volume);
            putNumber(r, "return_pct", row.returnPct);
            JSONObject sma = new JSONObject();
            for (Map.Entry<Integer, Double> entry : row.sma.entrySet()) {
                putNumber(sma, Integer.toString(entry.getKey()), entry.getValue());
            }
            r.put("sma", sma);
            putNumber(r, "volatility", row.volatility);
            putNumber(r, "rsi", row.rsi);
            putNumber(r, "momentum_pct", row.momentumPct);
            r.put("gap_filled", row.gapFilled);
            rows.put(r);
        }
        obj.put("rows", rows);
        return obj;
    }

    public static FeatureSet decodeProcessed(JSONObject obj) {
        expect(obj, ArtifactKind.PROCESSED);
        JSONObject specObj = obj.getJSONObject("spec");
        List<Integer> windows = new ArrayList<>();
        JSONArray windowArr = specObj.getJSONArray("sma_windows");
        for (int i = 0; i < windowArr.length(); i++) {
            windows.add(windowArr.getInt(i));
        }
        FeatureSpec spec = new FeatureSpec(
                windows,
                specObj.getInt("volatility_window"),
                specObj.getInt("rsi_period"),
                specObj.getInt("momentum_period")
        );
        JSONArray rowsArr = obj.getJSONArray("rows");
        List<FeatureRow> rows = new ArrayList<>(rowsArr.length());
        for (int i = 0; i < rowsArr.length(); i++) {
            JSONObject r = rowsArr.getJSONObject(i);
            JSONObject smaObj = r.getJSONObject("sma");
            Map<Integer, Double> sma = new LinkedHashMap<>();
            for (Integer window : spec.smaWindows) {
                sma.put(window, number(smaObj, Integer.toString(window)));
            }
            rows.add(new FeatureRow(
                    LocalDate.parse(r.getString("date")),
                    number(r, "close"),
                    number(r, "volume"),
                    number(r, "return_pct"),
                    sma,
                    number(r, "volatility"),
                    number(r, "rsi"),
                    number(r, "momentum_pct"),
                    r.optBoolean("gap_filled", false)
            ));
        }
        return new FeatureSet(
                Symbol.of(obj.getString("symbol")),
                decodeBars(obj.getJSONArray("bars")),
                rows,
                spec,
                obj.optString("source_fingerprint", "")
        );
    }

    public static JSONObject encodeForecast(ForecastArtifact f) {
        JSONObject obj = header(ArtifactKind.FORECAST, f.symbol);
        obj.put("as_of", f.asOf.toString());
        obj.put("data_as_of", f.dataAsOf.toString());
        putNumber(obj, "last_close", f.lastClose);
        putNumber(obj, "predicted_close", f.predictedClose);
        putNumber(obj, "predicted_change_pct", f.predictedChangePct);
        obj.put("direction", f.direction.name());
        putNumber(obj, "deadband", f.deadband);
        obj.put("model_version", f.modelVersion);
        obj.put("input_fingerprint", f.inputFingerprint);
        obj.put("generated_at", f.generatedAt.toString());
        return obj;
    }

    public static ForecastArtifact decodeForecast(JSONObject obj) {
        expect(obj, ArtifactKind.FORECAST);
        return ForecastArtifact.builder()
                .symbol(Symbol.of(obj.getString("symbol")))
                .asOf(Instant.parse(obj.getString("as_of")))
                .dataAsOf(LocalDate.parse(obj.getString("data_as_of")))
                .lastClose(number(obj, "last_close"))
                .predictedClose(number(obj, "predicted_close"))
                .predictedChangePct(number(obj, "predicted_change_pct"))
                .direction(Direction.valueOf(obj.getString("direction")))
                .deadband(number(obj, "deadband"))
                .modelVersion(obj.optString("model_version", ""))
                .inputFingerprint(obj.optString("input_fingerprint", ""))
                .generatedAt(Instant.parse(obj.getString("generated_at")))
                .build();
    }

    public static JSONObject encodeInsight(InsightArtifact insight) {
        JSONObject obj = header(ArtifactKind.INSIGHT, insight.symbol);
        obj.put("as_of", insight.asOf.toString());
        obj.put("data_as_of", insight.dataAsOf.toString());
        obj.put("commentary", insight.commentary);
        obj.put("generated_at", insight.generatedAt.toString());
        obj.put("source_model_id", insight.sourceModelId);
        obj.put("forecast_referenced", insight.forecastReferenced);
        obj.put("input_fingerprint", insight.inputFingerprint);
        return obj;
    }

    public static InsightArtifact decodeInsight(JSONObject obj) {
        expect(obj, ArtifactKind.INSIGHT);
        return InsightArtifact.builder()
                .symbol(Symbol.of(obj.getString("symbol")))
                .asOf(Instant.parse(obj.getString("as_of")))
                .dataAsOf(LocalDate.parse(obj.getString("data_as_of")))
                .commentary(obj.getString("commentary"))
                .generatedAt(Instant.parse(obj.getString("generated_at")))
                .sourceModelId(obj.optString("source_model_id", ""))
                .forecastReferenced(obj.optBoolean("forecast_referenced", false))
                .inputFingerprint(obj.optString("input_fingerprint", ""))
                .build();
    }

    public static JSONObject encodeModel(Symbol symbol, ModelSnapshot m) {
        JSONObject obj = header(ArtifactKind.MODEL, symbol);
        obj.put("model_type", m.modelType);
        obj.put("version", m.version);
        obj.put("look_back", m.lookBack);
        JSONArray weights = new JSONArray();
        for (double w : m.weights) {
            weights.put(w);
        }
        obj.put("weights", weights);
        putNumber(obj, "bias", m.bias);
        putNumber(obj, "scale_min", m.scaleMin);
        putNumber(obj, "scale_max", m.scaleMax);
        obj.put("trained_through", m.trainedThrough.toString());
        obj.put("trained_at", m.trainedAt.toString());
        obj.put("training_rows", m.trainingRows);
        putNumber(obj, "final_loss", m.finalLoss);
        return obj;
    }

    public static ModelSnapshot decodeModel(JSONObject obj) {
        expect(obj, ArtifactKind.MODEL);
        JSONArray arr = obj.getJSONArray("weights");
        double[] weights = new double[arr.length()];
        for (int i = 0; i < arr.length(); i++) {
            weights[i] = arr.getDouble(i);
        }
        return ModelSnapshot.builder()
                .modelType(obj.getString("model_type"))
                .version(obj.getString("version"))
                .lookBack(obj.getInt("look_back"))
                .weights(weights)
                .bias(number(obj, "bias"))
                .scaleMin(number(obj, "scale_min"))
                .scaleMax(number(obj, "scale_max"))
                .trainedThrough(LocalDate.parse(obj.getString("trained_through")))
                .trainedAt(Instant.parse(obj.getString("trained_at")))
                .trainingRows(obj.getInt("training_rows"))
                .finalLoss(number(obj, "final_loss"))
                .build();
    }

    public static JSONObject encodeNews(NewsSentiment news) {
        JSONObject obj = header(ArtifactKind.NEWS, news.symbol);
        obj.put("as_of", news.asOf.toString());
        obj.put("fetched_at", news.fetchedAt.toString());
        obj.put("source", news.source);
        obj.put("fingerprint", news.fingerprint());
        putNumber(obj, "average_score", news.averageScore());
        obj.put("overall_label", news.overallLabel().name());
        JSONArray headlines = new JSONArray();
        for (ScoredHeadline h : news.headlines) {
            JSONObject item = new JSONObject();
            item.put("title", h.item.title);
            item.put("link", h.item.link);
            item.put("publisher", h.item.source);
            item.put("published_at", h.item.publishedAt == null ? JSONObject.NULL : h.item.publishedAt.toString());
            putNumber(item, "sentiment_score", h.score);
            item.put("sentiment_label", h.label.name());
            putNumber(item, "subjectivity", h.subjectivity);
            headlines.put(item);
        }
        obj.put("headlines", headlines);
        return obj;
    }

    public static NewsSentiment decodeNews(JSONObject obj) {
        expect(obj, ArtifactKind.NEWS);
        JSONArray arr = obj.getJSONArray("headlines");
        List<ScoredHeadline> headlines = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            JSONObject item = arr.getJSONObject(i);
            String published = item.isNull("published_at") ? "" : item.optString("published_at", "");
            NewsItem newsItem = new NewsItem(
                    item.getString("title"),
                    item.optString("link", ""),
                    item.optString("publisher", ""),
                    published.isEmpty() ? null : Instant.parse(published)
            );
            double score = number(item, "sentiment_score");
            headlines.add(new ScoredHeadline(newsItem, Double.isFinite(score) ? score : 0.0, number(item, "subjectivity")));
        }
        return new NewsSentiment(
                Symbol.of(obj.getString("symbol")),
                Instant.parse(obj.getString("as_of")),
                Instant.parse(obj.getString("fetched_at")),
                obj.optString("source", ""),
                headlines
        );
    }

    /**
     * Byte-stable encoding of a feature set; equal inputs give equal strings.
     */
    public static String canonical(FeatureSet set) {
        return CanonicalJson.write(encodeProcessed(set));
    }

    private static JSONObject header(ArtifactKind kind, Symbol symbol) {
        JSONObject obj = new JSONObject();
        obj.put(SCHEMA, kind.schema());
        obj.put("symbol", symbol.value);
        return obj;
    }

    private static void expect(JSONObject obj, ArtifactKind kind) {
        String schema = obj == null ? "" : obj.optString(SCHEMA, "");
        if (!kind.schema().equals(schema)) {
            throw new IllegalArgumentException("expected schema " + kind.schema() + " but found '" + schema + "'");
        }
    }

    private static JSONArray encodeBars(List<PriceBar> bars) {
        JSONArray arr = new JSONArray();
        for (PriceBar bar : bars) {
            JSONObject b = new JSONObject();
            b.put("date", bar.tradeDate.toString());
            putNumber(b, "open", bar.open);
            putNumber(b, "high", bar.high);
            putNumber(b, "low", bar.low);
            putNumber(b, "close", bar.close);
            putNumber(b, "volume", bar.volume);
            arr.put(b);
        }
        return arr;
    }

    private static List<PriceBar> decodeBars(JSONArray arr) {
        List<PriceBar> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            JSONObject b = arr.getJSONObject(i);
            out.add(new PriceBar(
                    LocalDate.parse(b.getString("date")),
                    number(b, "open"),
                    number(b, "high"),
                    number(b, "low"),
                    number(b, "close"),
                    number(b, "volume")
            ));
        }
        return out;
    }

    private static void putNumber(JSONObject obj, String key, double value) {
        if (Double.isFinite(value)) {
            obj.put(key, value);
        } else {
            obj.put(key, JSONObject.NULL);
        }
    }

    private static double number(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return Double.NaN;
        }
        try {
            return obj.getDouble(key);
        } catch (JSONException e) {
            return Double.NaN;
        }
    }
}

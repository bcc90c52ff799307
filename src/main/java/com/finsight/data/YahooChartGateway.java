package com.finsight.data;

import com.finsight.config.Config;
import com.finsight.core.diagnostics.CauseCode;
import com.finsight.data.http.HttpClientEx;
import com.finsight.errors.NoDataError;
import com.finsight.errors.PipelineStageException;
import com.finsight.errors.TransientFetchError;
import com.finsight.model.HistoryRange;
import com.finsight.model.PriceBar;
import com.finsight.model.Quote;
import com.finsight.model.RawSeries;
import com.finsight.model.Symbol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 模块说明：YahooChartGateway（class）。
 * 主要职责：通过 Yahoo chart 接口拉取日线历史与实时报价，并按复权收盘价缩放 OHLC。
 * 使用建议：缺失收盘价的交易日以缺口 bar 透传，由 FeatureTransformer 统一前向填充。
 */
public final class YahooChartGateway implements MarketDataGateway {
    private static final Logger LOG = LogManager.getLogger(YahooChartGateway.class);
    static final String PROVIDER = "yahoo";

    private final HttpClientEx http;
    private final String baseUrl;
    private final int timeoutSec;
    private final RequestPacer pacer;
    private final Clock clock;

    public YahooChartGateway(Config config, HttpClientEx http) {
        this(config, http, Clock.systemUTC());
    }

    YahooChartGateway(Config config, HttpClientEx http, Clock clock) {
        this.http = http;
        String url = config.getString("market.yahoo.base_url");
        this.baseUrl = url.endsWith("/") ? url : url + "/";
        this.timeoutSec = Math.max(1, config.getInt("market.timeout_sec"));
        this.pacer = new RequestPacer(config.getLong("market.request_pause_ms", 0L));
        this.clock = clock;
    }

    @Override
    public String providerId() {
        return PROVIDER;
    }

    @Override
    public RawSeries fetchHistory(Symbol symbol, HistoryRange range) throws TransientFetchError, NoDataError {
        long period1 = range.start.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        long period2 = range.end.plusDays(1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        String url = baseUrl + encode(symbol.value)
                + "?period1=" + period1
                + "&period2=" + period2
                + "&interval=1d&events=div%7Csplit&includeAdjustedClose=true";
        String body = get(symbol, url);
        List<PriceBar> bars = parseHistory(symbol, body);
        LOG.debug("yahoo history symbol={} range={} bars={}", symbol, range, bars.size());
        return new RawSeries(symbol, bars, clock.instant(), PROVIDER);
    }

    @Override
    public Quote fetchQuote(Symbol symbol) throws TransientFetchError, NoDataError {
        String url = baseUrl + encode(symbol.value) + "?range=1d&interval=1m";
        String body = get(symbol, url);
        try {
            JSONObject meta = firstResult(symbol, body).optJSONObject("meta");
            double price = meta == null ? Double.NaN : meta.optDouble("regularMarketPrice", Double.NaN);
            if (!Double.isFinite(price) || price <= 0.0) {
                throw new NoDataError(PROVIDER + " " + symbol.value + ": quote has no regularMarketPrice");
            }
            long epoch = meta.optLong("regularMarketTime", 0L);
            Instant timestamp = epoch > 0L ? Instant.ofEpochSecond(epoch) : clock.instant();
            return new Quote(symbol, price, timestamp);
        } catch (JSONException e) {
            throw new TransientFetchError(CauseCode.PARSE, PROVIDER + " " + symbol.value + ": malformed quote payload", e);
        }
    }

    private String get(Symbol symbol, String url) throws TransientFetchError, NoDataError {
        try {
            pacer.await();
            return http.getText(url, timeoutSec);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientFetchError(CauseCode.CANCELLED, PROVIDER + " " + symbol.value + ": interrupted", e);
        } catch (Exception e) {
            PipelineStageException mapped = FetchErrors.classify(PROVIDER, symbol, e);
            if (mapped instanceof NoDataError) {
                throw (NoDataError) mapped;
            }
            throw (TransientFetchError) mapped;
        }
    }

    List<PriceBar> parseHistory(Symbol symbol, String body) throws TransientFetchError, NoDataError {
        try {
            JSONObject r0 = firstResult(symbol, body);
            JSONArray timestamps = r0.optJSONArray("timestamp");
            JSONObject indicators = r0.optJSONObject("indicators");
            JSONArray quoteArr = indicators == null ? null : indicators.optJSONArray("quote");
            JSONObject quote0 = (quoteArr == null || quoteArr.length() == 0) ? null : quoteArr.optJSONObject(0);
            if (timestamps == null || timestamps.length() == 0 || quote0 == null) {
                throw new NoDataError(PROVIDER + " " + symbol.value + ": empty series");
            }
            JSONArray adjArr = indicators.optJSONArray("adjclose");
            JSONObject adj0 = (adjArr == null || adjArr.length() == 0) ? null : adjArr.optJSONObject(0);
            JSONArray adjCloses = adj0 == null ? null : adj0.optJSONArray("adjclose");

            JSONArray opens = quote0.optJSONArray("open");
            JSONArray highs = quote0.optJSONArray("high");
            JSONArray lows = quote0.optJSONArray("low");
            JSONArray closes = quote0.optJSONArray("close");
            JSONArray volumes = quote0.optJSONArray("volume");
            if (closes == null) {
                throw new TransientFetchError(CauseCode.PARSE, PROVIDER + " " + symbol.value + ": close array missing");
            }

            List<PriceBar> out = new ArrayList<>(timestamps.length());
            int withClose = 0;
            for (int i = 0; i < timestamps.length(); i++) {
                long epoch = timestamps.optLong(i, 0L);
                if (epoch <= 0L) {
                    continue;
                }
                LocalDate d = Instant.ofEpochSecond(epoch).atZone(ZoneOffset.UTC).toLocalDate();
                double close = valueOrFallback(closes, i, Double.NaN);
                if (!Double.isFinite(close) || close <= 0.0) {
                    out.add(PriceBar.gap(d));
                    continue;
                }
                double open = valueOrFallback(opens, i, close);
                double high = valueOrFallback(highs, i, Math.max(open, close));
                double low = valueOrFallback(lows, i, Math.min(open, close));
                double volume = valueOrFallback(volumes, i, 0.0);

                double adjClose = valueOrFallback(adjCloses, i, close);
                double factor = adjClose > 0.0 ? adjClose / close : 1.0;
                out.add(new PriceBar(d, open * factor, high * factor, low * factor, close * factor, volume));
                withClose++;
            }
            if (withClose == 0) {
                throw new NoDataError(PROVIDER + " " + symbol.value + ": no bars with a close");
            }
            out.sort(Comparator.comparing(b -> b.tradeDate));
            return out;
        } catch (JSONException e) {
            throw new TransientFetchError(CauseCode.PARSE, PROVIDER + " " + symbol.value + ": malformed chart payload", e);
        }
    }

    private JSONObject firstResult(Symbol symbol, String body) throws NoDataError {
        if (body == null || body.isBlank()) {
            throw new NoDataError(PROVIDER + " " + symbol.value + ": empty payload");
        }
        JSONObject root = new JSONObject(body);
        JSONObject chart = root.optJSONObject("chart");
        if (chart == null) {
            throw new JSONException("chart object missing");
        }
        JSONObject error = chart.optJSONObject("error");
        if (error != null) {
            throw new NoDataError(PROVIDER + " " + symbol.value + ": " + error.optString("code", "error")
                    + " " + error.optString("description", ""));
        }
        JSONArray result = chart.optJSONArray("result");
        JSONObject r0 = (result == null || result.length() == 0) ? null : result.optJSONObject(0);
        if (r0 == null) {
            throw new NoDataError(PROVIDER + " " + symbol.value + ": empty result");
        }
        return r0;
    }

    private double valueOrFallback(JSONArray arr, int index, double fallback) {
        if (arr == null || index < 0 || index >= arr.length() || arr.isNull(index)) {
            return fallback;
        }
        double value = arr.optDouble(index, Double.NaN);
        if (!Double.isFinite(value)) {
            return fallback;
        }
        return value;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

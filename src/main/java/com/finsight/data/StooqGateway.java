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

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Daily bars and last quote from Stooq CSV endpoints. Stooq prices are already adjusted.
 */
public final class StooqGateway implements MarketDataGateway {
    private static final Logger LOG = LogManager.getLogger(StooqGateway.class);
    static final String PROVIDER = "stooq";

    private final HttpClientEx http;
    private final String historyUrl;
    private final String quoteUrl;
    private final String suffix;
    private final int timeoutSec;
    private final RequestPacer pacer;
    private final Clock clock;

    public StooqGateway(Config config, HttpClientEx http) {
        this(config, http, Clock.systemUTC());
    }

    StooqGateway(Config config, HttpClientEx http, Clock clock) {
        this.http = http;
        this.historyUrl = config.getString("market.stooq.history_url");
        this.quoteUrl = config.getString("market.stooq.quote_url");
        this.suffix = config.getString("market.stooq.suffix", "").toLowerCase(Locale.ROOT);
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
        String body = get(symbol, String.format(historyUrl, stooqTicker(symbol)));
        List<PriceBar> bars = new ArrayList<>();
        for (PriceBar bar : parseCsv(symbol, body)) {
            if (!bar.tradeDate.isBefore(range.start) && !bar.tradeDate.isAfter(range.end)) {
                bars.add(bar);
            }
        }
        if (bars.isEmpty()) {
            throw new NoDataError(PROVIDER + " " + symbol.value + ": no bars in " + range);
        }
        LOG.debug("stooq history symbol={} range={} bars={}", symbol, range, bars.size());
        return new RawSeries(symbol, bars, clock.instant(), PROVIDER);
    }

    @Override
    public Quote fetchQuote(Symbol symbol) throws TransientFetchError, NoDataError {
        String body = get(symbol, String.format(quoteUrl, stooqTicker(symbol)));
        rejectHitsLimit(symbol, body);
        String[] lines = body == null ? new String[0] : body.trim().split("\\r?\\n");
        if (lines.length < 2) {
            throw new NoDataError(PROVIDER + " " + symbol.value + ": empty quote");
        }
        String[] cols = lines[1].split(",");
        if (cols.length < 7) {
            throw new TransientFetchError(CauseCode.PARSE, PROVIDER + " " + symbol.value + ": unexpected quote row");
        }
        if ("N/D".equalsIgnoreCase(cols[6].trim())) {
            throw new NoDataError(PROVIDER + " " + symbol.value + ": quote not available");
        }
        try {
            double price = Double.parseDouble(cols[6].trim());
            LocalDateTime at = LocalDateTime.parse(cols[1].trim() + "T" + cols[2].trim());
            return new Quote(symbol, price, at.toInstant(ZoneOffset.UTC));
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new TransientFetchError(CauseCode.PARSE, PROVIDER + " " + symbol.value + ": unreadable quote row", e);
        }
    }

    String stooqTicker(Symbol symbol) {
        String lower = symbol.value.toLowerCase(Locale.ROOT);
        if (suffix.isEmpty() || lower.contains(".") || lower.startsWith("^")) {
            return lower;
        }
        return lower + suffix;
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

    // stooq answers 200 with a plain-text notice once the daily quota is spent
    private static void rejectHitsLimit(Symbol symbol, String body) throws TransientFetchError {
        if (body != null && body.toLowerCase(Locale.ROOT).contains("exceeded the daily hits limit")) {
            throw new TransientFetchError(CauseCode.RATE_LIMITED, PROVIDER + " " + symbol.value + ": daily hits limit");
        }
    }

    List<PriceBar> parseCsv(Symbol symbol, String body) throws TransientFetchError, NoDataError {
        String text = body == null ? "" : body.trim();
        if (text.isEmpty() || text.equalsIgnoreCase("No data")) {
            throw new NoDataError(PROVIDER + " " + symbol.value + ": no data");
        }
        rejectHitsLimit(symbol, text);
        String[] lines = text.split("\\r?\\n");
        String header = lines[0].trim().toLowerCase(Locale.ROOT);
        if (!header.startsWith("date,open,high,low,close")) {
            String sample = text.length() > 120 ? text.substring(0, 120) : text;
            throw new TransientFetchError(CauseCode.PARSE, PROVIDER + " " + symbol.value + ": unexpected payload " + sample);
        }

        List<PriceBar> all = new ArrayList<>(Math.max(64, lines.length));
        int malformed = 0;
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] cols = line.split(",");
            if (cols.length < 5) {
                malformed++;
                continue;
            }
            try {
                LocalDate date = LocalDate.parse(cols[0].trim());
                double close = parseDouble(cols[4]);
                if (!(close > 0.0)) {
                    continue;
                }
                double open = orElse(parseDouble(cols[1]), close);
                double high = orElse(parseDouble(cols[2]), Math.max(open, close));
                double low = orElse(parseDouble(cols[3]), Math.min(open, close));
                double volume = cols.length >= 6 ? orElse(parseDouble(cols[5]), 0.0) : 0.0;
                all.add(new PriceBar(date, open, high, low, close, volume));
            } catch (NumberFormatException | DateTimeParseException e) {
                malformed++;
            }
        }
        if (malformed > 0) {
            LOG.debug("stooq symbol={} skipped {} malformed rows", symbol, malformed);
        }
        if (all.isEmpty()) {
            throw new NoDataError(PROVIDER + " " + symbol.value + ": csv has no usable rows");
        }
        all.sort(Comparator.comparing(b -> b.tradeDate));
        return all;
    }

    private static double parseDouble(String input) {
        String v = input == null ? "" : input.trim();
        if (v.isEmpty() || v.equalsIgnoreCase("null") || v.equalsIgnoreCase("N/D")) {
            return Double.NaN;
        }
        return Double.parseDouble(v);
    }

    private static double orElse(double value, double fallback) {
        return Double.isFinite(value) ? value : fallback;
    }
}

package com.finsight.support;

import com.finsight.core.diagnostics.CauseCode;
import com.finsight.data.MarketDataGateway;
import com.finsight.errors.NoDataError;
import com.finsight.errors.TransientFetchError;
import com.finsight.model.HistoryRange;
import com.finsight.model.Quote;
import com.finsight.model.RawSeries;
import com.finsight.model.Symbol;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted gateway. History answers are chosen per symbol; unscripted symbols get a 120-bar series.
 */
public final class FakeGateway implements MarketDataGateway {

    @FunctionalInterface
    public interface HistoryScript {
        RawSeries fetch(Symbol symbol, int attempt) throws TransientFetchError, NoDataError;
    }

    private final Map<Symbol, HistoryScript> history = new ConcurrentHashMap<>();
    private final Map<Symbol, AtomicInteger> historyCalls = new ConcurrentHashMap<>();
    private final Map<Symbol, Double> quotes = new ConcurrentHashMap<>();
    private final AtomicInteger quoteCalls = new AtomicInteger();
    private volatile boolean quotesDown = false;
    private volatile Instant quoteTime = Instant.parse("2024-06-03T15:30:00Z");

    public FakeGateway history(String symbol, HistoryScript script) {
        history.put(Symbol.of(symbol), script);
        return this;
    }

    public FakeGateway series(String symbol, RawSeries series) {
        return history(symbol, (s, attempt) -> series);
    }

    public FakeGateway quote(String symbol, double price) {
        quotes.put(Symbol.of(symbol), price);
        return this;
    }

    public FakeGateway quotesDown(boolean down) {
        this.quotesDown = down;
        return this;
    }

    public FakeGateway quoteTime(Instant at) {
        this.quoteTime = at;
        return this;
    }

    public int historyCalls(String symbol) {
        AtomicInteger calls = historyCalls.get(Symbol.of(symbol));
        return calls == null ? 0 : calls.get();
    }

    public int quoteCalls() {
        return quoteCalls.get();
    }

    @Override
    public RawSeries fetchHistory(Symbol symbol, HistoryRange range) throws TransientFetchError, NoDataError {
        int attempt = historyCalls.computeIfAbsent(symbol, s -> new AtomicInteger()).incrementAndGet();
        HistoryScript script = history.get(symbol);
        if (script == null) {
            return TestSeries.raw(symbol.value, 120);
        }
        return script.fetch(symbol, attempt);
    }

    @Override
    public Quote fetchQuote(Symbol symbol) throws TransientFetchError, NoDataError {
        quoteCalls.incrementAndGet();
        if (quotesDown) {
            throw new TransientFetchError(CauseCode.FETCH_FAILED, "fake " + symbol.value + ": connection refused");
        }
        Double price = quotes.get(symbol);
        if (price == null) {
            throw new NoDataError("fake " + symbol.value + ": no quote");
        }
        return new Quote(symbol, price, quoteTime);
    }

    @Override
    public String providerId() {
        return "fake";
    }
}

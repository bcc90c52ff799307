package com.finsight.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;

/**
 * Historical bars for one symbol as returned by a market data provider.
 */
public final class RawSeries {
    public final Symbol symbol;
    public final List<PriceBar> bars;
    public final Instant fetchedAt;
    public final String source;

    public RawSeries(Symbol symbol, List<PriceBar> bars, Instant fetchedAt, String source) {
        this.symbol = symbol;
        this.bars = bars == null ? List.of() : Collections.unmodifiableList(List.copyOf(bars));
        this.fetchedAt = fetchedAt == null ? Instant.EPOCH : fetchedAt;
        this.source = source == null ? "" : source;
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public LocalDate lastTradeDate() {
        if (bars.isEmpty()) {
            return null;
        }
        return bars.get(bars.size() - 1).tradeDate;
    }

    /**
     * Symbol plus one line per bar. fetchedAt and source are excluded so a re-fetch of identical data hashes the same.
     */
    public String canonicalEncoding() {
        StringBuilder sb = new StringBuilder(bars.size() * 64 + 16);
        sb.append(symbol.value).append('\n');
        for (PriceBar bar : bars) {
            sb.append(bar.tradeDate).append(',')
                    .append(bar.open).append(',')
                    .append(bar.high).append(',')
                    .append(bar.low).append(',')
                    .append(bar.close).append(',')
                    .append(bar.volume).append('\n');
        }
        return sb.toString();
    }

    public String fingerprint() {
        return sha256Hex(canonicalEncoding());
    }

    static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}

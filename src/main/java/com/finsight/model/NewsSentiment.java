package com.finsight.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Scored headlines of one symbol for one window, newest first.
 */
public final class NewsSentiment {
    public final Symbol symbol;
    public final Instant asOf;
    public final Instant fetchedAt;
    public final String source;
    public final List<ScoredHeadline> headlines;

    public NewsSentiment(Symbol symbol, Instant asOf, Instant fetchedAt, String source, List<ScoredHeadline> headlines) {
        this.symbol = symbol;
        this.asOf = asOf;
        this.fetchedAt = fetchedAt;
        this.source = source == null ? "" : source;
        this.headlines = headlines == null ? List.of() : Collections.unmodifiableList(List.copyOf(headlines));
    }

    public double averageScore() {
        if (headlines.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (ScoredHeadline h : headlines) {
            sum += h.score;
        }
        return sum / headlines.size();
    }

    public SentimentLabel overallLabel() {
        return SentimentLabel.classify(averageScore());
    }

    public List<ScoredHeadline> top(int limit) {
        return headlines.subList(0, Math.min(Math.max(0, limit), headlines.size()));
    }

    /**
     * Hash of titles and links only, so an identical refetch is recognised as unchanged.
     */
    public String fingerprint() {
        StringBuilder sb = new StringBuilder(headlines.size() * 96 + 16);
        sb.append(symbol.value).append('\n');
        for (ScoredHeadline h : headlines) {
            sb.append(h.item.title).append('\t').append(h.item.link).append('\n');
        }
        return RawSeries.sha256Hex(sb.toString());
    }
}

package com.finsight.news;

import com.finsight.model.NewsItem;
import com.finsight.model.ScoredHeadline;
import com.finsight.model.SentimentLabel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class HeadlineSentimentScorerTest {
    private final HeadlineSentimentScorer scorer = new HeadlineSentimentScorer();

    @Test
    void bullishAndBearishWordsShouldSetPolarity() {
        ScoredHeadline up = scorer.score(headline("Apple beats estimates as iPhone sales surge"));
        ScoredHeadline down = scorer.score(headline("Tesla shares plunge after delivery miss"));

        assertEquals(1.0, up.score, 1e-9);
        assertEquals(SentimentLabel.POSITIVE, up.label);
        assertEquals(-1.0, down.score, 1e-9);
        assertEquals(SentimentLabel.NEGATIVE, down.label);
    }

    @Test
    void mixedOrPlainHeadlinesShouldBeNeutral() {
        ScoredHeadline mixed = scorer.score(headline("Microsoft beats on cloud but shares fall"));
        ScoredHeadline plain = scorer.score(headline("Apple to hold developer conference in June"));

        assertEquals(0.0, mixed.score, 1e-9);
        assertEquals(SentimentLabel.NEUTRAL, mixed.label);
        assertEquals(0.0, plain.score, 1e-9);
        assertEquals(SentimentLabel.NEUTRAL, plain.label);
        assertEquals(0.0, plain.subjectivity, 1e-9);
    }

    @Test
    void negatorShouldFlipTheFollowingHit() {
        assertEquals(-1.0, scorer.score(headline("Apple earnings not strong enough")).score, 1e-9);
        assertEquals(1.0, scorer.score(headline("Nvidia shows no decline in demand")).score, 1e-9);
    }

    @Test
    void subjectivityShouldCountOpinionWords() {
        // shocking, selloff, analysts, say, stock, overvalued
        ScoredHeadline h = scorer.score(headline("Shocking selloff: analysts say the stock is overvalued"));

        assertEquals(2.0 / 6.0, h.subjectivity, 1e-9);
        assertEquals(-1.0, h.score, 1e-9);
    }

    @Test
    void tokenizeShouldLowercaseAndDropPunctuation() {
        assertArrayEquals(new String[]{"s", "p", "500", "hits", "record", "doesn't", "stop"},
                HeadlineSentimentScorer.tokenize("S&P 500 hits RECORD; doesn't stop!"));
        assertEquals(0, HeadlineSentimentScorer.tokenize("  ").length);
    }

    private static NewsItem headline(String title) {
        return new NewsItem(title, "https://example.com/a", "Example Wire", null);
    }
}

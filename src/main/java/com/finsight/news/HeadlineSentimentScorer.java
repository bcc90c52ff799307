package com.finsight.news;

import com.finsight.model.NewsItem;
import com.finsight.model.ScoredHeadline;

import java.util.Locale;
import java.util.Set;

/**
 * Keyword polarity for short headlines.
 * <p>
 * score = (bullish - bearish) / (bullish + bearish) over matched words, 0 when nothing matches.
 * A negator ("not", "no", "never", "without") within the two preceding tokens flips a hit.
 * subjectivity = opinion words / content words, clamped to [0, 1].
 */
public final class HeadlineSentimentScorer {
    private static final Set<String> BULLISH = Set.of(
            "beat", "beats", "surge", "surges", "soar", "soars", "jump", "jumps", "rally", "rallies",
            "gain", "gains", "rise", "rises", "record", "upgrade", "upgrades", "upgraded", "strong",
            "growth", "profit", "profits", "outperform", "outperforms", "bullish", "boost", "boosts",
            "raise", "raises", "raised", "win", "wins", "approval", "approved", "expands", "breakthrough",
            "buy", "optimistic", "rebound", "rebounds", "higher", "tops", "exceeds"
    );
    private static final Set<String> BEARISH = Set.of(
            "miss", "misses", "missed", "plunge", "plunges", "slump", "slumps", "fall", "falls", "drop",
            "drops", "tumble", "tumbles", "sink", "sinks", "downgrade", "downgrades", "downgraded", "weak",
            "loss", "losses", "lawsuit", "investigation", "recall", "cut", "cuts", "layoffs", "bearish", "warns",
            "warning", "fraud", "decline", "declines", "lower", "sell", "selloff", "crash", "fears",
            "underperform", "delay", "delays", "fine", "fined", "bankruptcy", "concerns"
    );
    private static final Set<String> OPINION = Set.of(
            "best", "worst", "great", "terrible", "amazing", "awful", "huge", "massive", "shocking",
            "stunning", "should", "must", "bet", "bets", "hot", "cheap", "expensive", "overvalued",
            "undervalued", "brilliant", "disappointing", "impressive", "risky", "bullish", "bearish",
            "optimistic", "fears"
    );
    private static final Set<String> NEGATORS = Set.of("not", "no", "never", "without", "isn't", "doesn't", "won't");
    private static final Set<String> STOPWORDS = Set.of(
            "the", "a", "an", "and", "or", "of", "to", "in", "on", "at", "for", "as", "is", "are", "its",
            "with", "by", "from", "after", "over"
    );

    public ScoredHeadline score(NewsItem item) {
        String[] tokens = tokenize(item.title);
        int bullish = 0;
        int bearish = 0;
        int opinion = 0;
        int content = 0;
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            if (token.isEmpty() || STOPWORDS.contains(token)) {
                continue;
            }
            content++;
            if (OPINION.contains(token)) {
                opinion++;
            }
            int polarity = BULLISH.contains(token) ? 1 : BEARISH.contains(token) ? -1 : 0;
            if (polarity == 0) {
                continue;
            }
            if (negated(tokens, i)) {
                polarity = -polarity;
            }
            if (polarity > 0) {
                bullish++;
            } else {
                bearish++;
            }
        }
        double score = bullish + bearish == 0 ? 0.0 : (bullish - bearish) / (double) (bullish + bearish);
        double subjectivity = content == 0 ? 0.0 : Math.min(1.0, opinion / (double) content);
        return new ScoredHeadline(item, score, subjectivity);
    }

    private static boolean negated(String[] tokens, int index) {
        for (int j = Math.max(0, index - 2); j < index; j++) {
            if (NEGATORS.contains(tokens[j])) {
                return true;
            }
        }
        return false;
    }

    static String[] tokenize(String text) {
        if (text == null || text.isBlank()) {
            return new String[0];
        }
        return text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9'\\s]", " ").trim().split("\\s+");
    }
}

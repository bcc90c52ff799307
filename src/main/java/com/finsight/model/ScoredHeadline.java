package com.finsight.model;

/**
 * A headline with its polarity in [-1, 1] and subjectivity in [0, 1].
 */
public final class ScoredHeadline {
    public final NewsItem item;
    public final double score;
    public final SentimentLabel label;
    public final double subjectivity;

    public ScoredHeadline(NewsItem item, double score, double subjectivity) {
        this.item = item;
        this.score = score;
        this.label = SentimentLabel.classify(score);
        this.subjectivity = subjectivity;
    }
}

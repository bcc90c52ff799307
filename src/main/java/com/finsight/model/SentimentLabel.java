package com.finsight.model;

public enum SentimentLabel {
    POSITIVE,
    NEGATIVE,
    NEUTRAL;

    public static final double THRESHOLD = 0.1;

    /**
     * Scores strictly above +0.1 are positive, strictly below -0.1 negative.
     */
    public static SentimentLabel classify(double score) {
        if (!Double.isFinite(score)) {
            return NEUTRAL;
        }
        if (score > THRESHOLD) {
            return POSITIVE;
        }
        if (score < -THRESHOLD) {
            return NEGATIVE;
        }
        return NEUTRAL;
    }
}

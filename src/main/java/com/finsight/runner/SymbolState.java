package com.finsight.runner;

/**
 * Terminal state of one symbol within a run.
 */
public enum SymbolState {
    /** forecast and insight both current after this run */
    COMMITTED,
    /** forecast or insight failed, at least one pointer advanced */
    PARTIALLY_COMMITTED,
    /** stored artifacts already reflect this input; nothing written */
    UNCHANGED,
    /** no data or insufficient history; nothing advanced */
    SKIPPED,
    /** fetch exhausted, store error, cancellation, unexpected error, or a stage failed with nothing to advance */
    FAILED
}

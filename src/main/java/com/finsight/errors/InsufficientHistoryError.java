package com.finsight.errors;

import com.finsight.core.diagnostics.CauseCode;

public class InsufficientHistoryError extends PipelineStageException {
    private final int required;
    private final int actual;

    public InsufficientHistoryError(int required, int actual) {
        super(CauseCode.INSUFFICIENT_HISTORY, "insufficient history: required=" + required + ", actual=" + actual);
        this.required = required;
        this.actual = actual;
    }

    public int required() {
        return required;
    }

    public int actual() {
        return actual;
    }
}

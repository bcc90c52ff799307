package com.finsight.errors;

import com.finsight.core.diagnostics.CauseCode;

public class InsightError extends PipelineStageException {
    public InsightError(String message) {
        super(CauseCode.INSIGHT_FAILED, message);
    }

    public InsightError(CauseCode causeCode, String message, Throwable cause) {
        super(causeCode, message, cause);
    }
}

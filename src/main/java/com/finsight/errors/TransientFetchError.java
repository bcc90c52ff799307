package com.finsight.errors;

import com.finsight.core.diagnostics.CauseCode;

/**
 * Network failure, timeout, rate limit, server error or unreadable payload. Retried by the orchestrator.
 */
public class TransientFetchError extends PipelineStageException {
    public TransientFetchError(CauseCode causeCode, String message) {
        super(causeCode, message);
    }

    public TransientFetchError(CauseCode causeCode, String message, Throwable cause) {
        super(causeCode, message, cause);
    }
}

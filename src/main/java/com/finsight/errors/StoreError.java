package com.finsight.errors;

import com.finsight.core.diagnostics.CauseCode;

/**
 * Artifact store failure. Any store error during commit leaves every latest pointer untouched.
 */
public class StoreError extends PipelineStageException {
    public StoreError(String message) {
        super(CauseCode.STORE_ERROR, message);
    }

    public StoreError(String message, Throwable cause) {
        super(CauseCode.STORE_ERROR, message, cause);
    }
}

package com.finsight.errors;

import com.finsight.core.diagnostics.CauseCode;

public class NoDataError extends PipelineStageException {
    public NoDataError(String message) {
        super(CauseCode.NO_DATA, message);
    }
}

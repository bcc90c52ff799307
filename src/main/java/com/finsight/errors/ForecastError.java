package com.finsight.errors;

import com.finsight.core.diagnostics.CauseCode;

public class ForecastError extends PipelineStageException {
    public ForecastError(String message) {
        super(CauseCode.FORECAST_FAILED, message);
    }

    public ForecastError(String message, Throwable cause) {
        super(CauseCode.FORECAST_FAILED, message, cause);
    }
}

package com.finsight.data;

import com.finsight.core.diagnostics.CauseCode;
import com.finsight.data.http.HttpStatusException;
import com.finsight.errors.NoDataError;
import com.finsight.errors.PipelineStageException;
import com.finsight.errors.TransientFetchError;
import com.finsight.model.Symbol;

import java.net.http.HttpTimeoutException;
import java.util.Locale;

/**
 * Maps transport failures onto the fetch error taxonomy shared by all providers.
 */
final class FetchErrors {
    private FetchErrors() {
    }

    static PipelineStageException classify(String provider, Symbol symbol, Exception e) {
        String where = provider + " " + symbol.value;
        if (e instanceof HttpStatusException) {
            int status = ((HttpStatusException) e).statusCode();
            if (status == 404) {
                return new NoDataError(where + ": not found (HTTP 404)");
            }
            if (status == 429) {
                return new TransientFetchError(CauseCode.RATE_LIMITED, where + ": rate limited (HTTP 429)", e);
            }
            return new TransientFetchError(CauseCode.FETCH_FAILED, where + ": HTTP " + status, e);
        }
        if (e instanceof HttpTimeoutException) {
            return new TransientFetchError(CauseCode.TIMEOUT, where + ": timed out", e);
        }
        return new TransientFetchError(classifyFailureMessage(e.getMessage()), where + ": " + describe(e), e);
    }

    static CauseCode classifyFailureMessage(String message) {
        String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (msg.contains("timed out") || msg.contains("timeout")) {
            return CauseCode.TIMEOUT;
        }
        if (msg.contains("rate limit") || msg.contains("daily hits limit") || msg.contains("too many requests")) {
            return CauseCode.RATE_LIMITED;
        }
        return CauseCode.FETCH_FAILED;
    }

    static String describe(Throwable e) {
        String msg = e.getMessage();
        return msg == null || msg.isBlank() ? e.getClass().getSimpleName() : msg;
    }
}

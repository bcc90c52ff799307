package com.finsight.runner;

import com.finsight.core.diagnostics.CauseCode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class StageOutcome {
    public final Stage stage;
    public final StageStatus status;
    public final CauseCode cause;
    public final String message;
    public final int attempts;
    public final long elapsedMs;

    public static StageOutcome ok(Stage stage, int attempts, long elapsedMs) {
        return new StageOutcome(stage, StageStatus.OK, CauseCode.NONE, "", attempts, elapsedMs);
    }

    public static StageOutcome reused(Stage stage, String message) {
        return new StageOutcome(stage, StageStatus.REUSED, CauseCode.NONE, message, 0, 0L);
    }

    public static StageOutcome failed(Stage stage, CauseCode cause, String message, int attempts, long elapsedMs) {
        return new StageOutcome(stage, StageStatus.FAILED, cause, message, attempts, elapsedMs);
    }

    public static StageOutcome skipped(Stage stage, CauseCode cause, String message, int attempts, long elapsedMs) {
        return new StageOutcome(stage, StageStatus.SKIPPED, cause, message, attempts, elapsedMs);
    }
}

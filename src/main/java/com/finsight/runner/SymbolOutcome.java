package com.finsight.runner;

import com.finsight.core.diagnostics.CauseCode;
import com.finsight.model.ArtifactKind;
import com.finsight.model.Symbol;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 模块说明：SymbolOutcome（class）。
 * 主要职责：记录单个标的在一次运行中的终态、各阶段结果以及本次提交的版本号。
 */
public final class SymbolOutcome {
    public final Symbol symbol;
    public final SymbolState state;
    public final CauseCode cause;
    public final List<StageOutcome> stages;
    public final Map<ArtifactKind, String> committedVersions;

    public SymbolOutcome(
            Symbol symbol,
            SymbolState state,
            CauseCode cause,
            List<StageOutcome> stages,
            Map<ArtifactKind, String> committedVersions
    ) {
        this.symbol = symbol;
        this.state = state;
        this.cause = cause == null ? CauseCode.NONE : cause;
        this.stages = stages == null ? List.of() : List.copyOf(stages);
        Map<ArtifactKind, String> versions = new EnumMap<>(ArtifactKind.class);
        if (committedVersions != null) {
            versions.putAll(committedVersions);
        }
        this.committedVersions = Collections.unmodifiableMap(versions);
    }

    public Optional<StageOutcome> stage(Stage stage) {
        for (StageOutcome outcome : stages) {
            if (outcome.stage == stage) {
                return Optional.of(outcome);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return symbol + " " + state + (cause == CauseCode.NONE ? "" : " cause=" + cause);
    }
}

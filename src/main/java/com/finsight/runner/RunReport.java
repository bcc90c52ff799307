package com.finsight.runner;

import com.finsight.model.Symbol;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Result of one orchestrator invocation, one outcome per requested symbol in request order.
 */
public final class RunReport {
    public final String runId;
    public final Instant asOf;
    public final boolean forceRefresh;
    public final String trigger;
    public final Instant startedAt;
    public final Instant finishedAt;
    public final List<SymbolOutcome> outcomes;

    public RunReport(
            String runId,
            Instant asOf,
            boolean forceRefresh,
            String trigger,
            Instant startedAt,
            Instant finishedAt,
            List<SymbolOutcome> outcomes
    ) {
        this.runId = runId;
        this.asOf = asOf;
        this.forceRefresh = forceRefresh;
        this.trigger = trigger;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public Optional<SymbolOutcome> outcomeFor(Symbol symbol) {
        for (SymbolOutcome outcome : outcomes) {
            if (outcome.symbol.equals(symbol)) {
                return Optional.of(outcome);
            }
        }
        return Optional.empty();
    }

    public long count(SymbolState state) {
        return outcomes.stream().filter(o -> o.state == state).count();
    }

    /**
     * SUCCESS when nothing failed, PARTIAL when some symbols failed or partially committed, FAILED when all failed.
     */
    public String status() {
        long failed = count(SymbolState.FAILED);
        if (!outcomes.isEmpty() && failed == outcomes.size()) {
            return "FAILED";
        }
        if (failed > 0 || count(SymbolState.PARTIALLY_COMMITTED) > 0) {
            return "PARTIAL";
        }
        return "SUCCESS";
    }
}

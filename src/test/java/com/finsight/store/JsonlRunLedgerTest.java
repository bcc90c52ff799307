package com.finsight.store;

import com.finsight.core.diagnostics.CauseCode;
import com.finsight.model.ArtifactKind;
import com.finsight.model.Symbol;
import com.finsight.runner.RunReport;
import com.finsight.runner.Stage;
import com.finsight.runner.StageOutcome;
import com.finsight.runner.SymbolOutcome;
import com.finsight.runner.SymbolState;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlRunLedgerTest {
    @TempDir
    Path tempDir;

    @Test
    void recordShouldAppendOneLinePerRun() throws Exception {
        Path file = tempDir.resolve("runs").resolve("runs.jsonl");
        JsonlRunLedger ledger = new JsonlRunLedger(file);

        ledger.record(report("run-1", SymbolState.COMMITTED));
        ledger.record(report("run-2", SymbolState.FAILED));

        assertEquals(2, Files.readAllLines(file).size());
        List<JSONObject> recent = ledger.recent(5);
        assertEquals(2, recent.size());
        assertEquals("run-2", recent.get(0).getString("run_id"));
        assertEquals("FAILED", recent.get(0).getString("status"));
        assertEquals("run-1", recent.get(1).getString("run_id"));
        assertEquals(1, ledger.recent(1).size());
    }

    @Test
    void encodedRunShouldListStagesAndVersions() throws Exception {
        JsonlRunLedger ledger = new JsonlRunLedger(tempDir.resolve("runs.jsonl"));
        ledger.record(report("run-3", SymbolState.COMMITTED));

        JSONObject symbol = ledger.recent(1).get(0).getJSONArray("symbols").getJSONObject(0);

        assertEquals("AAPL", symbol.getString("symbol"));
        assertEquals("COMMITTED", symbol.getString("state"));
        assertEquals("20240603T120000Z", symbol.getJSONObject("committed_versions").getString("forecast"));
        assertEquals("FETCH", symbol.getJSONArray("stages").getJSONObject(0).getString("stage"));
        assertEquals(2, symbol.getJSONArray("stages").getJSONObject(0).getInt("attempts"));
    }

    @Test
    void missingFileShouldReadAsEmpty() throws Exception {
        assertTrue(new JsonlRunLedger(tempDir.resolve("none.jsonl")).recent(10).isEmpty());
    }

    private static RunReport report(String runId, SymbolState state) {
        SymbolOutcome outcome = new SymbolOutcome(
                Symbol.of("AAPL"),
                state,
                state == SymbolState.FAILED ? CauseCode.FETCH_FAILED : CauseCode.NONE,
                List.of(StageOutcome.ok(Stage.FETCH, 2, 40L)),
                state == SymbolState.COMMITTED ? Map.of(ArtifactKind.FORECAST, "20240603T120000Z") : Map.of()
        );
        Instant asOf = Instant.parse("2024-06-03T12:00:00Z");
        return new RunReport(runId, asOf, false, "manual", asOf, asOf.plusSeconds(3), List.of(outcome));
    }
}

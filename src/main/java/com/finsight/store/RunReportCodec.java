package com.finsight.store;

import com.finsight.model.ArtifactKind;
import com.finsight.runner.RunReport;
import com.finsight.runner.StageOutcome;
import com.finsight.runner.SymbolOutcome;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Map;

/**
 * JSON form of a run report as written to the run ledger.
 */
public final class RunReportCodec {
    private RunReportCodec() {
    }

    public static JSONObject encode(RunReport report) {
        JSONObject obj = new JSONObject();
        obj.put("schema", "finsight.run.v1");
        obj.put("run_id", report.runId);
        obj.put("trigger", report.trigger);
        obj.put("as_of", report.asOf.toString());
        obj.put("force_refresh", report.forceRefresh);
        obj.put("started_at", report.startedAt.toString());
        obj.put("finished_at", report.finishedAt.toString());
        obj.put("status", report.status());
        JSONArray symbols = new JSONArray();
        for (SymbolOutcome outcome : report.outcomes) {
            symbols.put(encodeOutcome(outcome));
        }
        obj.put("symbols", symbols);
        return obj;
    }

    public static JSONObject encodeOutcome(SymbolOutcome outcome) {
        JSONObject s = new JSONObject();
        s.put("symbol", outcome.symbol.value);
        s.put("state", outcome.state.name());
        s.put("cause", outcome.cause.name());
        s.put("stages", encodeStages(outcome));
        JSONObject versions = new JSONObject();
        for (Map.Entry<ArtifactKind, String> entry : outcome.committedVersions.entrySet()) {
            versions.put(entry.getKey().segment(), entry.getValue());
        }
        s.put("committed_versions", versions);
        return s;
    }

    public static JSONArray encodeStages(SymbolOutcome outcome) {
        JSONArray stages = new JSONArray();
        for (StageOutcome stage : outcome.stages) {
            JSONObject st = new JSONObject();
            st.put("stage", stage.stage.name());
            st.put("status", stage.status.name());
            st.put("cause", stage.cause.name());
            st.put("message", stage.message == null ? "" : stage.message);
            st.put("attempts", stage.attempts);
            st.put("elapsed_ms", stage.elapsedMs);
            stages.put(st);
        }
        return stages;
    }
}

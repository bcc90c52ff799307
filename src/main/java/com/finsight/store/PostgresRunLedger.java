package com.finsight.store;

import com.finsight.db.Database;
import com.finsight.db.mybatis.MyBatisSupport;
import com.finsight.db.mybatis.RunInsertParam;
import com.finsight.db.mybatis.RunMapper;
import com.finsight.db.mybatis.RunSymbolInsertParam;
import com.finsight.errors.StoreError;
import com.finsight.runner.RunReport;
import com.finsight.runner.SymbolOutcome;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.json.JSONException;
import org.json.JSONObject;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

public final class PostgresRunLedger implements RunLedger {
    private final Database database;

    public PostgresRunLedger(Database database) {
        this.database = database;
    }

    @Override
    public void record(RunReport report) throws StoreError {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            RunMapper mapper = session.getMapper(RunMapper.class);
            mapper.insertRun(RunInsertParam.builder()
                    .runId(report.runId)
                    .trigger(report.trigger)
                    .asOf(utc(report.asOf))
                    .forceRefresh(report.forceRefresh)
                    .startedAt(utc(report.startedAt))
                    .finishedAt(utc(report.finishedAt))
                    .status(report.status())
                    .reportJson(CanonicalJson.write(RunReportCodec.encode(report)))
                    .build());
            for (SymbolOutcome outcome : report.outcomes) {
                mapper.insertRunSymbol(RunSymbolInsertParam.builder()
                        .runId(report.runId)
                        .symbol(outcome.symbol.value)
                        .state(outcome.state.name())
                        .cause(outcome.cause.name())
                        .stagesJson(CanonicalJson.write(RunReportCodec.encodeStages(outcome)))
                        .build());
            }
            conn.commit();
        } catch (SQLException | PersistenceException e) {
            throw new StoreError("failed recording run " + report.runId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<JSONObject> recent(int limit) throws StoreError {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            List<JSONObject> out = new ArrayList<>();
            for (String json : session.getMapper(RunMapper.class).listRecentReports(Math.max(0, limit))) {
                out.add(new JSONObject(json));
            }
            return out;
        } catch (SQLException | PersistenceException | JSONException e) {
            throw new StoreError("failed reading runs: " + e.getMessage(), e);
        }
    }

    private static OffsetDateTime utc(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }
}

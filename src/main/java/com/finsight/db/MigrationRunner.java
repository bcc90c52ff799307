package com.finsight.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent PostgreSQL schema migration runner.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);
    static final int TARGET_VERSION = 1;

    public void run(Database database) throws SQLException {
        String schema = database.schema();
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            st.execute("SET search_path TO " + schema + ", public");
            st.execute("CREATE TABLE IF NOT EXISTS metadata (" +
                    "meta_key TEXT PRIMARY KEY," +
                    "meta_value TEXT NOT NULL," +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                writeSchemaVersion(conn, TARGET_VERSION);
                if (currentVersion != TARGET_VERSION) {
                    LOG.info("schema {} migrated from version {} to {}", schema, currentVersion, TARGET_VERSION);
                }
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + safe(e.getMessage());
                LOG.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
        }
    }

    List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();
        sqls.add("CREATE TABLE IF NOT EXISTS artifact_versions (" +
                "symbol TEXT NOT NULL," +
                "kind TEXT NOT NULL," +
                "version TEXT NOT NULL," +
                "payload TEXT NOT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "PRIMARY KEY(symbol, kind, version)" +
                ")");
        sqls.add("CREATE TABLE IF NOT EXISTS artifact_latest (" +
                "symbol TEXT NOT NULL," +
                "kind TEXT NOT NULL," +
                "version TEXT NOT NULL," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "PRIMARY KEY(symbol, kind)," +
                "FOREIGN KEY(symbol, kind, version) REFERENCES artifact_versions(symbol, kind, version)" +
                ")");
        sqls.add("CREATE TABLE IF NOT EXISTS runs (" +
                "run_id TEXT PRIMARY KEY," +
                "run_trigger TEXT NOT NULL," +
                "as_of TIMESTAMPTZ NOT NULL," +
                "force_refresh BOOLEAN NOT NULL," +
                "started_at TIMESTAMPTZ NOT NULL," +
                "finished_at TIMESTAMPTZ NOT NULL," +
                "status TEXT NOT NULL," +
                "report_json TEXT NOT NULL" +
                ")");
        sqls.add("CREATE TABLE IF NOT EXISTS run_symbols (" +
                "run_id TEXT NOT NULL REFERENCES runs(run_id)," +
                "symbol TEXT NOT NULL," +
                "state TEXT NOT NULL," +
                "cause TEXT NOT NULL," +
                "stages_json TEXT NOT NULL," +
                "PRIMARY KEY(run_id, symbol)" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_runs_as_of ON runs(as_of DESC)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_run_symbols_symbol ON run_symbols(symbol, run_id)");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'")) {
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    String value = rs.getString(1);
                    if (value != null && !value.trim().isEmpty()) {
                        return Integer.parseInt(value.trim());
                    }
                }
            }
        } catch (SQLException | NumberFormatException e) {
            LOG.debug("schema_version unreadable, treating as 0: {}", e.getMessage());
            return 0;
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, now()) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.executeUpdate();
        }
    }

    private String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replace('\n', ' ').replace('\r', ' ').replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}

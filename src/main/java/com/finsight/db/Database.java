package com.finsight.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 模块说明：Database（class）。
 * 主要职责：持有 PostgreSQL 数据源，打开连接时固定 search_path 到产物所在 schema。
 * 使用建议：每次存取新开连接并由调用方关闭；连接失败按 SQLState 给出提示，日志中的 URL 已脱敏。
 */
public final class Database {
    private static final Logger LOG = LogManager.getLogger(Database.class);
    private static final Pattern SCHEMA_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    static final String DEFAULT_SCHEMA = "finsight";

    enum ConnectHint {
        AUTH, UNREACHABLE, MISSING_DATABASE, TIMEOUT, OTHER
    }

    private final PGSimpleDataSource dataSource = new PGSimpleDataSource();
    private final String jdbcUrl;
    private final String schema;

    public Database(String jdbcUrl, String user, String pass, String schema, int connectTimeoutSec) {
        String url = jdbcUrl == null ? "" : jdbcUrl.trim();
        if (!url.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("db.url must be a PostgreSQL JDBC URL (jdbc:postgresql://...), got '"
                    + mask(url) + "'");
        }
        this.jdbcUrl = url;
        this.schema = normalizeSchema(schema);
        dataSource.setUrl(url);
        if (user != null && !user.isBlank()) {
            dataSource.setUser(user.trim());
        }
        if (pass != null) {
            dataSource.setPassword(pass);
        }
        dataSource.setCurrentSchema(this.schema);
        dataSource.setApplicationName("finsight-pipeline");
        dataSource.setConnectTimeout(Math.max(1, connectTimeoutSec));
    }

    public Connection connect() throws SQLException {
        Connection conn;
        try {
            conn = dataSource.getConnection();
        } catch (SQLException e) {
            ConnectHint hint = hint(e);
            LOG.error("db connect failed url={} schema={} hint={} sqlstate={}: {}",
                    maskedJdbcUrl(), schema, hint, e.getSQLState(), e.getMessage());
            throw new SQLException("db connect failed (" + hint.name().toLowerCase(Locale.ROOT) + "): "
                    + maskedJdbcUrl(), e.getSQLState(), e.getErrorCode(), e);
        }
        try (Statement st = conn.createStatement()) {
            st.execute("SET search_path TO " + schema + ", public");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        return mask(jdbcUrl);
    }

    static String mask(String url) {
        return url
                .replaceAll("(?i)(password=)[^&]+", "$1***")
                .replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
    }

    static String normalizeSchema(String raw) {
        String value = raw == null || raw.isBlank() ? DEFAULT_SCHEMA : raw.trim();
        if (!SCHEMA_NAME.matcher(value).matches()) {
            throw new IllegalArgumentException("invalid db.schema '" + value + "', expected " + SCHEMA_NAME.pattern());
        }
        return value;
    }

    /**
     * PostgreSQL SQLState classes: 28 auth, 08 connection, 3D missing catalog.
     */
    static ConnectHint hint(SQLException e) {
        String state = e.getSQLState() == null ? "" : e.getSQLState();
        String msg = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (state.startsWith("28")) {
            return ConnectHint.AUTH;
        }
        if (state.startsWith("3D")) {
            return ConnectHint.MISSING_DATABASE;
        }
        if (msg.contains("timed out") || msg.contains("timeout")) {
            return ConnectHint.TIMEOUT;
        }
        if (state.startsWith("08")) {
            return ConnectHint.UNREACHABLE;
        }
        return ConnectHint.OTHER;
    }
}

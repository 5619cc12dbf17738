package com.marketbot.pk.db;

import com.marketbot.pk.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * PostgreSQL connection source. Every connection is pointed at the configured schema.
 */
public final class Database {
    private static final Logger LOG = LogManager.getLogger(Database.class);
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");

    private final DataSource dataSource;
    private final String jdbcUrl;
    private final String schema;
    private final boolean sqlLogEnabled;

    public Database(String jdbcUrl, String user, String pass, String schema, boolean sqlLogEnabled) {
        if (isBlank(jdbcUrl)) {
            throw new IllegalArgumentException("db.url must not be empty");
        }
        this.jdbcUrl = jdbcUrl.trim();
        if (!this.jdbcUrl.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("db.url must use PostgreSQL JDBC URL (jdbc:postgresql://...)");
        }
        this.schema = normalizeSchema(schema);
        this.sqlLogEnabled = sqlLogEnabled;

        PGSimpleDataSource pg = new PGSimpleDataSource();
        pg.setUrl(this.jdbcUrl);
        if (!isBlank(user)) {
            pg.setUser(user.trim());
        }
        if (pass != null) {
            pg.setPassword(pass);
        }
        pg.setCurrentSchema(this.schema);
        pg.setApplicationName("marketbot-pk");
        this.dataSource = pg;
    }

    /**
     * Builds from config; {@code MARKETBOT_DB_URL}, {@code MARKETBOT_DB_USER} and
     * {@code MARKETBOT_DB_PASS} take precedence when set.
     */
    public static Database fromConfig(Config config) {
        return new Database(
                envOr("MARKETBOT_DB_URL", config.getString("db.url")),
                envOr("MARKETBOT_DB_USER", config.getString("db.user")),
                envOr("MARKETBOT_DB_PASS", config.getString("db.pass")),
                config.getString("db.schema"),
                config.getBoolean("db.sql_log.enabled", false)
        );
    }

    public Connection connect() throws SQLException {
        try {
            Connection raw = dataSource.getConnection();
            try (Statement st = raw.createStatement()) {
                st.execute("SET search_path TO " + schema + ", public");
            }
            return sqlLogEnabled ? SqlLogProxy.wrapConnection(raw, SQL_LOG) : raw;
        } catch (SQLException e) {
            String details = "DB connect failed: jdbc_url=" + maskedJdbcUrl()
                    + ", schema=" + schema
                    + ", hint=" + classifyConnectFailure(e)
                    + ", cause=" + safe(e.getMessage());
            LOG.error(details);
            throw new SQLException(details, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        String out = jdbcUrl;
        out = out.replaceAll("(?i)(password=)[^&]+", "$1***");
        out = out.replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
        return out;
    }

    private static String envOr(String name, String fallback) {
        String value = System.getenv(name);
        return isBlank(value) ? fallback : value.trim();
    }

    private static String normalizeSchema(String raw) {
        String value = isBlank(raw) ? "marketbot" : raw.trim();
        if (!value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("invalid db.schema, allowed pattern: [A-Za-z_][A-Za-z0-9_]*");
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String classifyConnectFailure(SQLException e) {
        String msg = safe(e == null ? null : e.getMessage()).toLowerCase(Locale.ROOT);
        if (msg.contains("password authentication failed") || msg.contains("permission denied")) {
            return "auth";
        }
        if (msg.contains("does not exist")) {
            return "missing_database";
        }
        if (msg.contains("connection refused") || msg.contains("connection attempt failed")) {
            return "unreachable";
        }
        return "connection_error";
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}

package com.marketbot.pk.db;

import com.marketbot.pk.model.ColumnField;
import com.marketbot.pk.model.FundamentalField;
import com.marketbot.pk.model.RatioField;
import com.marketbot.pk.model.StatementField;
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
    static final int SCHEMA_VERSION = 1;

    static final List<String[]> KNOWN_COMMODITIES = List.of(
            new String[]{"Gold 24K (Per Tola)", "gold", "tola"},
            new String[]{"Gold 22K (Per Tola)", "gold", "tola"},
            new String[]{"Gold 21K (Per Tola)", "gold", "tola"},
            new String[]{"Gold 18K (Per Tola)", "gold", "tola"},
            new String[]{"Silver (Per Tola)", "silver", "tola"},
            new String[]{"Silver (Per 10 Grams)", "silver", "10 grams"}
    );

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
                seedCommodities(conn);
                writeSchemaVersion(conn, SCHEMA_VERSION);
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + SCHEMA_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + safe(e.getMessage());
                LOG.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
            LOG.info("schema {} ready at version {} (was {})", schema, SCHEMA_VERSION, currentVersion);
        }
    }

    List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();

        sqls.add("CREATE TABLE IF NOT EXISTS companies (" +
                "id BIGSERIAL PRIMARY KEY," +
                "symbol TEXT NOT NULL UNIQUE," +
                "name TEXT NOT NULL," +
                "description TEXT NULL," +
                "sector TEXT NULL," +
                "sector_code TEXT NULL," +
                "logo_url TEXT NULL," +
                "is_active BOOLEAN NOT NULL DEFAULT TRUE," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        StringBuilder stocks = new StringBuilder("CREATE TABLE IF NOT EXISTS stocks (" +
                "id BIGSERIAL PRIMARY KEY," +
                "company_id BIGINT NOT NULL UNIQUE REFERENCES companies(id) ON DELETE CASCADE," +
                "open_price NUMERIC NULL," +
                "high_price NUMERIC NULL," +
                "low_price NUMERIC NULL," +
                "previous_close NUMERIC NULL,");
        for (FundamentalField field : FundamentalField.values()) {
            stocks.append(columnDef(field)).append(',');
        }
        for (RatioField field : RatioField.values()) {
            stocks.append(columnDef(field)).append(',');
        }
        stocks.append("last_updated TIMESTAMPTZ NULL)");
        sqls.add(stocks.toString());

        sqls.add("CREATE TABLE IF NOT EXISTS stock_history (" +
                "id BIGSERIAL PRIMARY KEY," +
                "stock_id BIGINT NOT NULL REFERENCES stocks(id) ON DELETE CASCADE," +
                "date DATE NOT NULL," +
                "open_price NUMERIC NULL," +
                "high_price NUMERIC NULL," +
                "low_price NUMERIC NULL," +
                "close_price NUMERIC NULL," +
                "volume BIGINT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (stock_id, date)" +
                ")");

        StringBuilder statements = new StringBuilder("CREATE TABLE IF NOT EXISTS financial_statements (" +
                "id BIGSERIAL PRIMARY KEY," +
                "company_id BIGINT NOT NULL REFERENCES companies(id) ON DELETE CASCADE," +
                "period_type TEXT NOT NULL," +
                "fiscal_year INTEGER NOT NULL," +
                "quarter INTEGER NULL,");
        for (StatementField field : StatementField.values()) {
            statements.append(columnDef(field)).append(',');
        }
        statements.append("updated_at TIMESTAMPTZ NOT NULL DEFAULT now())");
        sqls.add(statements.toString());
        sqls.add("CREATE UNIQUE INDEX IF NOT EXISTS ux_financial_statements_period " +
                "ON financial_statements(company_id, period_type, fiscal_year, COALESCE(quarter, 0))");

        sqls.add("CREATE TABLE IF NOT EXISTS commodities (" +
                "id BIGSERIAL PRIMARY KEY," +
                "name TEXT NOT NULL UNIQUE," +
                "category TEXT NOT NULL," +
                "unit TEXT NULL," +
                "current_price NUMERIC NULL," +
                "source TEXT NULL," +
                "last_updated TIMESTAMPTZ NULL" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS job_logs (" +
                "id BIGSERIAL PRIMARY KEY," +
                "job_name TEXT NOT NULL," +
                "status TEXT NOT NULL," +
                "started_at TIMESTAMPTZ NOT NULL," +
                "completed_at TIMESTAMPTZ NULL," +
                "duration_ms BIGINT NULL," +
                "result TEXT NULL," +
                "error_message TEXT NULL," +
                "retry_count INTEGER NOT NULL DEFAULT 0" +
                ")");

        sqls.add("CREATE INDEX IF NOT EXISTS idx_job_logs_name_started ON job_logs(job_name, started_at DESC)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_stock_history_date ON stock_history(date)");
        return sqls;
    }

    private static String columnDef(ColumnField field) {
        return field.column() + (field.integral() ? " BIGINT NULL" : " NUMERIC NULL");
    }

    private void seedCommodities(Connection conn) throws SQLException {
        String sql = "INSERT INTO commodities(name, category, unit) VALUES(?, ?, ?) ON CONFLICT(name) DO NOTHING";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (String[] row : KNOWN_COMMODITIES) {
                ps.setString(1, row[0]);
                ps.setString(2, row[1]);
                ps.setString(3, row[2]);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private int readSchemaVersion(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                String value = rs.getString(1);
                if (value != null && !value.trim().isEmpty()) {
                    return Integer.parseInt(value.trim());
                }
            }
        } catch (SQLException | NumberFormatException e) {
            LOG.warn("schema_version unreadable, assuming 0: {}", e.getMessage());
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
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        return oneLine.length() <= 180 ? oneLine : oneLine.substring(0, 177) + "...";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}

package com.marketbot.pk.db;

import com.marketbot.pk.model.FundamentalField;
import com.marketbot.pk.model.RatioField;
import com.marketbot.pk.model.StatementField;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationRunnerTest {

    private final List<String> statements = new MigrationRunner().buildStatements();

    @Test
    void buildStatements_shouldBeIdempotent() {
        for (String sql : statements) {
            assertTrue(sql.contains("IF NOT EXISTS"), sql);
        }
    }

    @Test
    void buildStatements_shouldCreateEveryStockColumnWriterUses() {
        String stocks = find("CREATE TABLE IF NOT EXISTS stocks");
        for (String column : StockDao.COLUMNS) {
            assertTrue(stocks.contains(column + " "), column);
        }
        assertTrue(stocks.contains("volume BIGINT NULL"));
        assertTrue(stocks.contains("current_price NUMERIC NULL"));
        assertTrue(stocks.contains(RatioField.ROE.column() + " NUMERIC NULL"));
        assertTrue(stocks.contains(FundamentalField.MARKET_CAP.column() + " NUMERIC NULL"));
    }

    @Test
    void buildStatements_shouldKeyHistoryAndStatementsByNaturalKey() {
        assertTrue(find("CREATE TABLE IF NOT EXISTS stock_history").contains("UNIQUE (stock_id, date)"));
        assertTrue(find("CREATE UNIQUE INDEX IF NOT EXISTS ux_financial_statements_period")
                .contains("COALESCE(quarter, 0)"));
        String financials = find("CREATE TABLE IF NOT EXISTS financial_statements");
        for (StatementField field : StatementField.values()) {
            assertTrue(financials.contains(field.column() + " "), field.column());
        }
    }

    @Test
    void knownCommodities_shouldMatchParsedRateNames() {
        assertEquals(6, MigrationRunner.KNOWN_COMMODITIES.size());
        assertEquals("Gold 24K (Per Tola)", MigrationRunner.KNOWN_COMMODITIES.get(0)[0]);
        assertEquals("Silver (Per 10 Grams)", MigrationRunner.KNOWN_COMMODITIES.get(5)[0]);
    }

    private String find(String prefix) {
        for (String sql : statements) {
            if (sql.startsWith(prefix)) {
                return sql;
            }
        }
        throw new AssertionError("no statement starting with " + prefix);
    }
}

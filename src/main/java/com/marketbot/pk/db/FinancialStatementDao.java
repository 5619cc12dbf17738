package com.marketbot.pk.db;

import com.marketbot.pk.db.mybatis.FinancialStatementMapper;
import com.marketbot.pk.db.mybatis.MyBatisSupport;
import com.marketbot.pk.model.FinancialPeriod;
import com.marketbot.pk.model.StatementField;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

public class FinancialStatementDao {
    private final Database database;

    public FinancialStatementDao(Database database) {
        this.database = database;
    }

    /**
     * Inserts the period or updates the existing row with the same
     * (company, period type, fiscal year, quarter) key. Only set fields are written.
     *
     * @return true when a new row was inserted
     */
    public boolean upsertPeriod(long companyId, FinancialPeriod period) throws SQLException {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<StatementField, Double> entry : period.values().entrySet()) {
            values.put(entry.getKey().column(), entry.getValue());
        }
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        String type = period.periodType().code();

        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            FinancialStatementMapper mapper = session.getMapper(FinancialStatementMapper.class);
            Long existing = mapper.selectPeriodId(companyId, type, period.fiscalYear(), period.quarter());
            if (existing != null) {
                if (!values.isEmpty()) {
                    mapper.updatePeriod(existing, values, now);
                }
                return false;
            }
            mapper.insertPeriod(companyId, type, period.fiscalYear(), period.quarter(), values, now);
            return true;
        }
    }
}

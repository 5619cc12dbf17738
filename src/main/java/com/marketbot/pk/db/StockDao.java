package com.marketbot.pk.db;

import com.marketbot.pk.db.mybatis.MyBatisSupport;
import com.marketbot.pk.db.mybatis.StockMapper;
import com.marketbot.pk.model.ColumnField;
import com.marketbot.pk.model.FundamentalField;
import com.marketbot.pk.model.RatioField;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class StockDao {
    public static final String OPEN_PRICE = "open_price";
    public static final String HIGH_PRICE = "high_price";
    public static final String LOW_PRICE = "low_price";
    public static final String PREVIOUS_CLOSE = "previous_close";

    static final Set<String> COLUMNS = buildColumns();

    private final Database database;

    public StockDao(Database database) {
        this.database = database;
    }

    public Optional<Long> findIdByCompany(long companyId) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return Optional.ofNullable(session.getMapper(StockMapper.class).selectIdByCompany(companyId));
        }
    }

    public Double currentPrice(long stockId) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(StockMapper.class).selectCurrentPrice(stockId);
        }
    }

    /**
     * Writes the given columns plus {@code last_updated}. Null values are dropped before the update,
     * so an absent value never overwrites a stored one.
     *
     * @return number of columns written, excluding {@code last_updated}
     */
    public int updateColumns(long stockId, Map<String, ?> values) throws SQLException {
        Map<String, Object> clean = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (!COLUMNS.contains(entry.getKey())) {
                throw new IllegalArgumentException("unknown stocks column: " + entry.getKey());
            }
            if (entry.getValue() != null) {
                clean.put(entry.getKey(), entry.getValue());
            }
        }
        if (clean.isEmpty()) {
            return 0;
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            session.getMapper(StockMapper.class).updateColumns(stockId, clean, OffsetDateTime.now(ZoneOffset.UTC));
        }
        return clean.size();
    }

    public boolean insertIfAbsent(long companyId) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(StockMapper.class).insertIfAbsent(companyId) > 0;
        }
    }

    private static Set<String> buildColumns() {
        Set<String> out = new HashSet<>();
        out.add(OPEN_PRICE);
        out.add(HIGH_PRICE);
        out.add(LOW_PRICE);
        out.add(PREVIOUS_CLOSE);
        for (ColumnField field : FundamentalField.values()) {
            out.add(field.column());
        }
        for (ColumnField field : RatioField.values()) {
            out.add(field.column());
        }
        return Collections.unmodifiableSet(out);
    }
}

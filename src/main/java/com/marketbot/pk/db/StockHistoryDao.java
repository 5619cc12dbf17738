package com.marketbot.pk.db;

import com.marketbot.pk.db.mybatis.MyBatisSupport;
import com.marketbot.pk.db.mybatis.StockHistoryMapper;
import com.marketbot.pk.db.mybatis.StockHistoryParam;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One row per stock per trading day; re-running a day overwrites that day's row.
 */
public class StockHistoryDao {
    private final Database database;

    public StockHistoryDao(Database database) {
        this.database = database;
    }

    public void upsert(StockHistoryParam row) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            session.getMapper(StockHistoryMapper.class).upsert(row);
        }
    }
}

package com.marketbot.pk.db;

import com.marketbot.pk.db.mybatis.CommodityMapper;
import com.marketbot.pk.db.mybatis.MyBatisSupport;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public class CommodityDao {
    private final Database database;

    public CommodityDao(Database database) {
        this.database = database;
    }

    /**
     * @return false when no commodity row carries this name
     */
    public boolean updatePrice(String name, double price, String source) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(CommodityMapper.class)
                    .updatePrice(name, price, source, OffsetDateTime.now(ZoneOffset.UTC)) > 0;
        }
    }
}

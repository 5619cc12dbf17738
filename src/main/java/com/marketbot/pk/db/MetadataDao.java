package com.marketbot.pk.db;

import com.marketbot.pk.db.mybatis.MetadataMapper;
import com.marketbot.pk.db.mybatis.MyBatisSupport;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

public class MetadataDao {
    public static final String LAST_DAILY_AT = "psx.last_daily_at";
    public static final String LAST_FULL_AT = "psx.last_full_at";

    private final Database database;

    public MetadataDao(Database database) {
        this.database = database;
    }

    public Optional<String> get(String key) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return Optional.ofNullable(session.getMapper(MetadataMapper.class).selectMetaValue(key));
        }
    }

    public void put(String key, String value) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            session.getMapper(MetadataMapper.class).upsertMeta(key, value, OffsetDateTime.now(ZoneOffset.UTC));
        }
    }
}

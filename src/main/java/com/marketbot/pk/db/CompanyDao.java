package com.marketbot.pk.db;

import com.marketbot.pk.db.mybatis.CompanyInsertParam;
import com.marketbot.pk.db.mybatis.CompanyMapper;
import com.marketbot.pk.db.mybatis.CompanyRow;
import com.marketbot.pk.db.mybatis.CompanyUpdateParam;
import com.marketbot.pk.db.mybatis.MyBatisSupport;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

public class CompanyDao {
    private final Database database;

    public CompanyDao(Database database) {
        this.database = database;
    }

    public Optional<CompanyRow> findBySymbol(String symbol) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return Optional.ofNullable(session.getMapper(CompanyMapper.class).selectBySymbol(symbol));
        }
    }

    /**
     * Updates only the non-null identity fields.
     *
     * @return false when there was nothing to write
     */
    public boolean updateIdentity(long companyId, String name, String description, String sector, String logoUrl)
            throws SQLException {
        if (name == null && description == null && sector == null && logoUrl == null) {
            return false;
        }
        CompanyUpdateParam row = CompanyUpdateParam.builder()
                .id(companyId)
                .name(name)
                .description(description)
                .sector(sector)
                .logoUrl(logoUrl)
                .updatedAt(OffsetDateTime.now(ZoneOffset.UTC))
                .build();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(CompanyMapper.class).updateIdentity(row) > 0;
        }
    }

    /**
     * Inserts a company unless the symbol already exists.
     *
     * @return the new id, or empty when the symbol was already present
     */
    public Optional<Long> insertIfAbsent(String symbol, String name, String sector, String sectorCode, String logoUrl)
            throws SQLException {
        CompanyInsertParam row = CompanyInsertParam.builder()
                .symbol(symbol)
                .name(name == null || name.trim().isEmpty() ? symbol : name)
                .sector(sector)
                .sectorCode(sectorCode)
                .logoUrl(logoUrl)
                .build();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            int inserted = session.getMapper(CompanyMapper.class).insertIfAbsent(row);
            return inserted > 0 ? Optional.ofNullable(row.getId()) : Optional.empty();
        }
    }
}

package com.marketbot.pk.db.mybatis;

import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;

import java.sql.Connection;

/**
 * Shared MyBatis bootstrap. Sessions run on connections handed out by {@code Database}.
 */
public final class MyBatisSupport {
    private static final SqlSessionFactory FACTORY = buildFactory();

    private MyBatisSupport() {
    }

    public static SqlSession openSession(Connection connection) {
        return FACTORY.openSession(connection);
    }

    private static SqlSessionFactory buildFactory() {
        Configuration config = new Configuration();
        config.setMapUnderscoreToCamelCase(true);

        config.addMapper(MetadataMapper.class);
        config.addMapper(CompanyMapper.class);
        config.addMapper(StockMapper.class);
        config.addMapper(StockHistoryMapper.class);
        config.addMapper(FinancialStatementMapper.class);
        config.addMapper(CommodityMapper.class);
        config.addMapper(JobLogMapper.class);

        return new SqlSessionFactoryBuilder().build(config);
    }
}

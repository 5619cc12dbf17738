package com.marketbot.pk.db.mybatis;

import org.apache.ibatis.annotations.Insert;

public interface StockHistoryMapper {
    @Insert("INSERT INTO stock_history(stock_id, date, open_price, high_price, low_price, close_price, volume) " +
            "VALUES(#{stockId}, #{date}, #{openPrice,jdbcType=NUMERIC}, #{highPrice,jdbcType=NUMERIC}, " +
            "#{lowPrice,jdbcType=NUMERIC}, #{closePrice,jdbcType=NUMERIC}, #{volume,jdbcType=BIGINT}) " +
            "ON CONFLICT(stock_id, date) DO UPDATE SET " +
            "open_price=COALESCE(excluded.open_price, stock_history.open_price), " +
            "high_price=COALESCE(excluded.high_price, stock_history.high_price), " +
            "low_price=COALESCE(excluded.low_price, stock_history.low_price), " +
            "close_price=COALESCE(excluded.close_price, stock_history.close_price), " +
            "volume=COALESCE(excluded.volume, stock_history.volume)")
    int upsert(StockHistoryParam row);
}

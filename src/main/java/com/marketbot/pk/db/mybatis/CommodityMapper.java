package com.marketbot.pk.db.mybatis;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

import java.time.OffsetDateTime;

public interface CommodityMapper {
    @Update("UPDATE commodities SET current_price = #{price}, source = #{source}, last_updated = #{lastUpdated} " +
            "WHERE name = #{name}")
    int updatePrice(
            @Param("name") String name,
            @Param("price") double price,
            @Param("source") String source,
            @Param("lastUpdated") OffsetDateTime lastUpdated
    );
}

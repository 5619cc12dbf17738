package com.marketbot.pk.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.OffsetDateTime;
import java.util.Map;

public interface StockMapper {
    @Select("SELECT id FROM stocks WHERE company_id = #{companyId}")
    Long selectIdByCompany(@Param("companyId") long companyId);

    @Select("SELECT current_price FROM stocks WHERE id = #{stockId}")
    Double selectCurrentPrice(@Param("stockId") long stockId);

    /**
     * Column names are keys of {@code values}; callers only pass names from the known field enums.
     */
    @Update({
            "<script>",
            "UPDATE stocks SET",
            "<foreach collection='values' index='column' item='value' separator=','>",
            "${column} = #{value}",
            "</foreach>",
            ", last_updated = #{lastUpdated}",
            "WHERE id = #{stockId}",
            "</script>"
    })
    int updateColumns(
            @Param("stockId") long stockId,
            @Param("values") Map<String, Object> values,
            @Param("lastUpdated") OffsetDateTime lastUpdated
    );

    @Insert("INSERT INTO stocks(company_id) VALUES(#{companyId}) ON CONFLICT(company_id) DO NOTHING")
    int insertIfAbsent(@Param("companyId") long companyId);
}

package com.marketbot.pk.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

public interface CompanyMapper {
    @Select("SELECT id, symbol, name, logo_url FROM companies WHERE symbol = #{symbol}")
    CompanyRow selectBySymbol(@Param("symbol") String symbol);

    @Update({
            "<script>",
            "UPDATE companies",
            "<set>",
            "<if test='name != null'>name = #{name},</if>",
            "<if test='description != null'>description = #{description},</if>",
            "<if test='sector != null'>sector = #{sector},</if>",
            "<if test='logoUrl != null'>logo_url = #{logoUrl},</if>",
            "updated_at = #{updatedAt}",
            "</set>",
            "WHERE id = #{id}",
            "</script>"
    })
    int updateIdentity(CompanyUpdateParam row);

    @Insert("INSERT INTO companies(symbol, name, sector, sector_code, logo_url) " +
            "VALUES(#{symbol}, #{name}, #{sector,jdbcType=VARCHAR}, #{sectorCode,jdbcType=VARCHAR}, #{logoUrl,jdbcType=VARCHAR}) " +
            "ON CONFLICT(symbol) DO NOTHING")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insertIfAbsent(CompanyInsertParam row);
}

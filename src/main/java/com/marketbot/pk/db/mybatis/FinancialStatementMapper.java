package com.marketbot.pk.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.OffsetDateTime;
import java.util.Map;

public interface FinancialStatementMapper {
    @Select({
            "<script>",
            "SELECT id FROM financial_statements",
            "WHERE company_id = #{companyId} AND period_type = #{periodType} AND fiscal_year = #{fiscalYear}",
            "<choose>",
            "<when test='quarter != null'>AND quarter = #{quarter}</when>",
            "<otherwise>AND quarter IS NULL</otherwise>",
            "</choose>",
            "LIMIT 1",
            "</script>"
    })
    Long selectPeriodId(
            @Param("companyId") long companyId,
            @Param("periodType") String periodType,
            @Param("fiscalYear") int fiscalYear,
            @Param("quarter") Integer quarter
    );

    @Update({
            "<script>",
            "UPDATE financial_statements SET",
            "<foreach collection='values' index='column' item='value' separator=','>",
            "${column} = #{value}",
            "</foreach>",
            ", updated_at = #{updatedAt}",
            "WHERE id = #{id}",
            "</script>"
    })
    int updatePeriod(
            @Param("id") long id,
            @Param("values") Map<String, Object> values,
            @Param("updatedAt") OffsetDateTime updatedAt
    );

    @Insert({
            "<script>",
            "INSERT INTO financial_statements(company_id, period_type, fiscal_year, quarter, updated_at",
            "<foreach collection='values' index='column'>, ${column}</foreach>",
            ") VALUES(#{companyId}, #{periodType}, #{fiscalYear}, #{quarter,jdbcType=INTEGER}, #{updatedAt}",
            "<foreach collection='values' item='value'>, #{value}</foreach>",
            ")",
            "</script>"
    })
    int insertPeriod(
            @Param("companyId") long companyId,
            @Param("periodType") String periodType,
            @Param("fiscalYear") int fiscalYear,
            @Param("quarter") Integer quarter,
            @Param("values") Map<String, Object> values,
            @Param("updatedAt") OffsetDateTime updatedAt
    );
}

package com.fincraft.etl.db.mybatis;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface CoverageMapper {
    @Select("SELECT c.entity_id, " +
            "COUNT(DISTINCT b.table_name) AS tables_with_data, " +
            "MAX(b.period) FILTER (WHERE b.table_name = #{tableName}) AS latest_period, " +
            "COUNT(b.id) FILTER (WHERE b.table_name = #{tableName}) AS record_count " +
            "FROM entity_catalog c " +
            "LEFT JOIN business_records b ON b.entity_id = c.entity_id " +
            "WHERE c.active = TRUE AND c.entity_kind = #{kind} " +
            "GROUP BY c.entity_id")
    List<CoverageInputRow> selectInputs(@Param("tableName") String tableName, @Param("kind") String kind);
}

package com.fincraft.etl.db.mybatis;

import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;
import java.util.List;

public interface BusinessRecordMapper {
    /**
     * Returns TRUE for an insert, FALSE for a replaced row, and no row when the fingerprint is unchanged.
     */
    @Select("INSERT INTO business_records(table_name, entity_id, period, report_type, fields, content_fingerprint, " +
            "source_run_id, fetched_at, updated_at) " +
            "VALUES(#{tableName}, #{entityId}, #{period}, #{reportType}, CAST(#{fieldsJson} AS jsonb), " +
            "#{contentFingerprint}, #{sourceRunId,jdbcType=VARCHAR}, #{fetchedAt}, now()) " +
            "ON CONFLICT(table_name, entity_id, period, report_type) DO UPDATE SET " +
            "fields=excluded.fields, content_fingerprint=excluded.content_fingerprint, " +
            "source_run_id=excluded.source_run_id, fetched_at=excluded.fetched_at, updated_at=now() " +
            "WHERE business_records.content_fingerprint IS DISTINCT FROM excluded.content_fingerprint " +
            "RETURNING (xmax = 0) AS inserted")
    @Options(flushCache = Options.FlushCachePolicy.TRUE, useCache = false)
    Boolean upsert(BusinessRecordRow row);

    @Select("SELECT table_name, entity_id, period, report_type, fields::text AS fields_json, content_fingerprint, " +
            "source_run_id, fetched_at FROM business_records " +
            "WHERE table_name=#{tableName} AND entity_id=#{entityId} AND period=#{period} AND report_type=#{reportType}")
    BusinessRecordRow find(
            @Param("tableName") String tableName,
            @Param("entityId") String entityId,
            @Param("period") LocalDate period,
            @Param("reportType") String reportType
    );

    @Select("SELECT entity_id, MAX(period) AS period FROM business_records WHERE table_name=#{tableName} GROUP BY entity_id")
    List<EntityPeriodRow> latestPeriods(@Param("tableName") String tableName);

    @Select({
            "<script>",
            "SELECT MAX(period) FROM business_records WHERE table_name=#{tableName} AND entity_id=#{entityId}",
            "<if test='reportType != null'>AND report_type=#{reportType}</if>",
            "</script>"
    })
    LocalDate latestPeriod(
            @Param("tableName") String tableName,
            @Param("entityId") String entityId,
            @Param("reportType") String reportType
    );

    @Select("SELECT COUNT(*) FROM business_records WHERE table_name=#{tableName} AND entity_id=#{entityId}")
    int countByEntity(@Param("tableName") String tableName, @Param("entityId") String entityId);
}

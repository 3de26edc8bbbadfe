package com.fincraft.etl.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.OffsetDateTime;
import java.util.List;

public interface WatermarkMapper {
    String COLUMNS = "table_name, entity_id, last_period_covered, last_success_time, last_fingerprint, last_status, " +
            "consecutive_failures, last_failure_reason, last_failure_time, updated_at";

    @Select("SELECT " + COLUMNS + " FROM extraction_watermarks WHERE table_name=#{tableName} AND entity_id=#{entityId}")
    WatermarkRow find(@Param("tableName") String tableName, @Param("entityId") String entityId);

    @Select("SELECT " + COLUMNS + " FROM extraction_watermarks WHERE table_name=#{tableName} ORDER BY entity_id")
    List<WatermarkRow> findAll(@Param("tableName") String tableName);

    /** GREATEST ignores NULL, so the covered period never moves backwards. */
    @Insert("INSERT INTO extraction_watermarks(table_name, entity_id, last_period_covered, last_success_time, " +
            "last_fingerprint, last_status, consecutive_failures, updated_at) " +
            "VALUES(#{tableName}, #{entityId}, #{period,jdbcType=DATE}, #{at}, #{fingerprint,jdbcType=VARCHAR}, " +
            "#{status}, 0, #{at}) " +
            "ON CONFLICT(table_name, entity_id) DO UPDATE SET " +
            "last_period_covered=GREATEST(extraction_watermarks.last_period_covered, excluded.last_period_covered), " +
            "last_success_time=excluded.last_success_time, " +
            "last_fingerprint=COALESCE(excluded.last_fingerprint, extraction_watermarks.last_fingerprint), " +
            "last_status=excluded.last_status, " +
            "consecutive_failures=0, " +
            "updated_at=excluded.updated_at")
    int markSuccess(WatermarkUpdateParam param);

    @Select("INSERT INTO extraction_watermarks(table_name, entity_id, last_status, consecutive_failures, " +
            "last_failure_reason, last_failure_time, updated_at) " +
            "VALUES(#{tableName}, #{entityId}, 'error', 1, #{failureReason}, #{at}, #{at}) " +
            "ON CONFLICT(table_name, entity_id) DO UPDATE SET " +
            "last_status='error', " +
            "consecutive_failures=extraction_watermarks.consecutive_failures + 1, " +
            "last_failure_reason=excluded.last_failure_reason, " +
            "last_failure_time=excluded.last_failure_time, " +
            "updated_at=excluded.updated_at " +
            "RETURNING consecutive_failures")
    @Options(flushCache = Options.FlushCachePolicy.TRUE, useCache = false)
    Integer markFailure(WatermarkUpdateParam param);

    @Update({
            "<script>",
            "UPDATE extraction_watermarks SET consecutive_failures=0, updated_at=#{at}",
            "WHERE table_name=#{tableName} AND consecutive_failures &gt; 0",
            "<if test='entityId != null'>AND entity_id=#{entityId}</if>",
            "</script>"
    })
    int resetFailures(
            @Param("tableName") String tableName,
            @Param("entityId") String entityId,
            @Param("at") OffsetDateTime at
    );

    @Select("SELECT " + COLUMNS + " FROM extraction_watermarks " +
            "WHERE table_name=#{tableName} AND consecutive_failures >= #{ceiling} ORDER BY entity_id")
    List<WatermarkRow> listAtOrAboveFailures(@Param("tableName") String tableName, @Param("ceiling") int ceiling);
}

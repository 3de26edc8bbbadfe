package com.fincraft.etl.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface LandingMapper {
    @Insert("INSERT INTO api_responses_landing(table_name, entity_id, run_id, status, content_fingerprint, " +
            "failure_reason, message, payload, fetched_at) " +
            "VALUES(#{tableName}, #{entityId}, #{runId}, #{status}, #{contentFingerprint,jdbcType=VARCHAR}, " +
            "#{failureReason,jdbcType=VARCHAR}, #{message,jdbcType=VARCHAR}, #{payload,jdbcType=VARCHAR}, #{fetchedAt})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(LandingRow row);

    @Select("SELECT id, table_name, entity_id, run_id, status, content_fingerprint, failure_reason, message, payload, fetched_at " +
            "FROM api_responses_landing WHERE run_id=#{runId} ORDER BY id")
    List<LandingRow> listByRun(@Param("runId") String runId);
}

package com.fincraft.etl.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.OffsetDateTime;
import java.util.List;

public interface RunMapper {
    @Update("UPDATE extraction_runs SET status='ABORTED', finished_at=#{finishedAt}, " +
            "notes=COALESCE(notes, '') || ';recovered_on_startup' WHERE status='RUNNING'")
    int recoverDanglingRuns(@Param("finishedAt") OffsetDateTime finishedAt);

    @Insert("INSERT INTO extraction_runs(run_id, table_name, started_at, status, notes) " +
            "VALUES(#{runId}, #{tableName}, #{startedAt}, 'RUNNING', #{notes,jdbcType=VARCHAR})")
    int insertRun(ExtractionRunRow row);

    @Update("UPDATE extraction_runs SET finished_at=#{finishedAt}, status=#{status}, scheduled_count=#{scheduledCount}, " +
            "inserted_count=#{insertedCount}, updated_count=#{updatedCount}, unchanged_count=#{unchangedCount}, " +
            "empty_count=#{emptyCount}, error_count=#{errorCount}, suspended_count=#{suspendedCount}, " +
            "notes=CASE WHEN #{notes,jdbcType=VARCHAR} IS NULL OR #{notes,jdbcType=VARCHAR} = '' THEN notes " +
            "ELSE COALESCE(notes, '') || ';' || #{notes,jdbcType=VARCHAR} END " +
            "WHERE run_id=#{runId}")
    int finishRun(ExtractionRunRow row);

    @Select("SELECT run_id, table_name, started_at, finished_at, status, scheduled_count, inserted_count, updated_count, " +
            "unchanged_count, empty_count, error_count, suspended_count, notes " +
            "FROM extraction_runs ORDER BY started_at DESC LIMIT #{limit}")
    List<ExtractionRunRow> listRecent(@Param("limit") int limit);
}

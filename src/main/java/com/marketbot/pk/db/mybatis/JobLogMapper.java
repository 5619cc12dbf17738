package com.marketbot.pk.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

import java.time.OffsetDateTime;

public interface JobLogMapper {
    @Insert("INSERT INTO job_logs(job_name, status, started_at) VALUES(#{jobName}, #{status}, #{startedAt})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insertStart(JobLogInsertParam row);

    @Update("UPDATE job_logs SET status = 'completed', completed_at = #{completedAt}, duration_ms = #{durationMs}, " +
            "result = #{result} WHERE id = #{id}")
    int markCompleted(
            @Param("id") long id,
            @Param("result") String result,
            @Param("durationMs") long durationMs,
            @Param("completedAt") OffsetDateTime completedAt
    );

    @Update("UPDATE job_logs SET status = 'failed', completed_at = #{completedAt}, duration_ms = #{durationMs}, " +
            "error_message = #{error}, retry_count = retry_count + 1 WHERE id = #{id}")
    int markFailed(
            @Param("id") long id,
            @Param("error") String error,
            @Param("durationMs") long durationMs,
            @Param("completedAt") OffsetDateTime completedAt
    );
}

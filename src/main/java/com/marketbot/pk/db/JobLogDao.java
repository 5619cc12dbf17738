package com.marketbot.pk.db;

import com.marketbot.pk.db.mybatis.JobLogInsertParam;
import com.marketbot.pk.db.mybatis.JobLogMapper;
import com.marketbot.pk.db.mybatis.MyBatisSupport;
import com.marketbot.pk.schedule.JobLogSink;
import org.apache.ibatis.session.SqlSession;
import org.json.JSONObject;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * {@code job_logs} writer. Result counts are stored as a JSON object.
 */
public class JobLogDao implements JobLogSink {
    static final String STATUS_RUNNING = "running";
    private static final int MAX_ERROR_CHARS = 4000;

    private final Database database;

    public JobLogDao(Database database) {
        this.database = database;
    }

    @Override
    public long logJobStart(String jobName) throws SQLException {
        JobLogInsertParam row = JobLogInsertParam.builder()
                .jobName(jobName)
                .status(STATUS_RUNNING)
                .startedAt(OffsetDateTime.now(ZoneOffset.UTC))
                .build();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            session.getMapper(JobLogMapper.class).insertStart(row);
        }
        if (row.getId() == null) {
            throw new SQLException("job_logs insert returned no id for " + jobName);
        }
        return row.getId();
    }

    @Override
    public void logJobComplete(long id, Map<String, Object> counts, long durationMs) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            session.getMapper(JobLogMapper.class)
                    .markCompleted(id, toJson(counts), durationMs, OffsetDateTime.now(ZoneOffset.UTC));
        }
    }

    @Override
    public void logJobFail(long id, String error, long durationMs) throws SQLException {
        String message = error == null ? "" : error;
        if (message.length() > MAX_ERROR_CHARS) {
            message = message.substring(0, MAX_ERROR_CHARS);
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            session.getMapper(JobLogMapper.class)
                    .markFailed(id, message, durationMs, OffsetDateTime.now(ZoneOffset.UTC));
        }
    }

    static String toJson(Map<String, Object> counts) {
        JSONObject json = new JSONObject();
        if (counts != null) {
            for (Map.Entry<String, Object> entry : counts.entrySet()) {
                json.put(entry.getKey(), entry.getValue() == null ? JSONObject.NULL : entry.getValue());
            }
        }
        return json.toString();
    }
}

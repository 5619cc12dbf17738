package com.marketbot.pk.schedule;

import java.sql.SQLException;
import java.util.Map;

/**
 * Records the start and outcome of every job run.
 */
public interface JobLogSink {
    long logJobStart(String jobName) throws SQLException;

    void logJobComplete(long id, Map<String, Object> counts, long durationMs) throws SQLException;

    void logJobFail(long id, String error, long durationMs) throws SQLException;
}

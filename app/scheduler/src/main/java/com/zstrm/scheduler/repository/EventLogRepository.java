package com.zstrm.scheduler.repository;

import static com.zstrm.common.JdbcTimestampUtils.toInstant;
import static com.zstrm.common.JdbcTimestampUtils.toTimestamp;

import com.zstrm.scheduler.model.EventLogRecord;
import com.zstrm.scheduler.model.EventType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Append-only audit trail; rows are never updated or deleted. */
@Repository
@RequiredArgsConstructor
public class EventLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long append(EventLogRecord event, Instant createdAt) {
    final String sql =
        """
        INSERT INTO event_logs (session_id, job_id, schedule_id, event_type, message, created_at)
        VALUES (:sessionId, :jobId, :scheduleId, :eventType, :message, :createdAt)
        RETURNING event_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sessionId", event.sessionId())
            .addValue("jobId", event.jobId())
            .addValue("scheduleId", event.scheduleId())
            .addValue("eventType", event.eventType().name())
            .addValue("message", event.message())
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.queryForObject(sql, params, Long.class);
  }

  public List<EventLogRecord> findRecent(int limit) {
    final String sql =
        """
        SELECT event_id, session_id, job_id, schedule_id, event_type, message, created_at
        FROM event_logs
        ORDER BY event_id DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<EventLogRecord> findByJobId(long jobId) {
    final String sql =
        """
        SELECT event_id, session_id, job_id, schedule_id, event_type, message, created_at
        FROM event_logs
        WHERE job_id = :jobId
        ORDER BY event_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private EventLogRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new EventLogRecord(
        rs.getLong("event_id"),
        rs.getObject("session_id", Long.class),
        rs.getObject("job_id", Long.class),
        rs.getObject("schedule_id", Long.class),
        EventType.valueOf(rs.getString("event_type")),
        rs.getString("message"),
        toInstant(rs.getTimestamp("created_at")));
  }
}

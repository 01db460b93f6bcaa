/*
 * Where: scheduler data access
 * What: sessions rows, one per execution attempt of a schedule
 * Why: the dashboard and run-now endpoint read back what the loop started
 */
package com.zstrm.scheduler.repository;

import static com.zstrm.common.JdbcTimestampUtils.toInstant;
import static com.zstrm.common.JdbcTimestampUtils.toTimestamp;

import com.zstrm.scheduler.model.JobStatus;
import com.zstrm.scheduler.model.SessionRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SessionRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT session_id, schedule_id, job_id, started_at, ended_at, status,
             pipeline_description, reason
      FROM sessions
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(SessionRecord record) {
    final String sql =
        """
        INSERT INTO sessions (
          schedule_id, job_id, started_at, ended_at, status, pipeline_description, reason
        ) VALUES (
          :scheduleId, :jobId, :startedAt, :endedAt, :status, :pipelineDescription, :reason
        )
        RETURNING session_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("scheduleId", record.scheduleId())
            .addValue("jobId", record.jobId())
            .addValue("startedAt", toTimestamp(record.startedAt()))
            .addValue("endedAt", toTimestamp(record.endedAt()))
            .addValue("status", record.status().name())
            .addValue("pipelineDescription", record.pipelineDescription())
            .addValue("reason", record.reason());
    return jdbcTemplate.queryForObject(sql, params, Long.class);
  }

  public Optional<SessionRecord> findById(long sessionId) {
    final String sql = SELECT_COLUMNS + "WHERE session_id = :sessionId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("sessionId", sessionId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Ends a running session; a second call leaves the first outcome in place. */
  public int complete(long sessionId, JobStatus status, Instant endedAt, String reason) {
    final String sql =
        """
        UPDATE sessions
        SET status = :status,
            ended_at = :endedAt,
            reason = :reason
        WHERE session_id = :sessionId
          AND ended_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sessionId", sessionId)
            .addValue("status", status.name())
            .addValue("endedAt", toTimestamp(endedAt))
            .addValue("reason", reason);
    return jdbcTemplate.update(sql, params);
  }

  public List<SessionRecord> findRecent(int limit) {
    final String sql = SELECT_COLUMNS + "ORDER BY session_id DESC LIMIT :limit";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<SessionRecord> findLatestByJobId(long jobId) {
    final String sql = SELECT_COLUMNS + "WHERE job_id = :jobId ORDER BY session_id DESC LIMIT 1";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int countAll() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sessions", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  public int countActive() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sessions WHERE ended_at IS NULL",
            new MapSqlParameterSource(),
            Integer.class);
    return count == null ? 0 : count;
  }

  private SessionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SessionRecord(
        rs.getLong("session_id"),
        rs.getLong("schedule_id"),
        rs.getLong("job_id"),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("ended_at")),
        JobStatus.valueOf(rs.getString("status")),
        rs.getString("pipeline_description"),
        rs.getString("reason"));
  }
}

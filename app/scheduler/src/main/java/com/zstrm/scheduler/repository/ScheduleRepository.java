package com.zstrm.scheduler.repository;

import static com.zstrm.common.JdbcTimestampUtils.toInstant;
import static com.zstrm.common.JdbcTimestampUtils.toTimestamp;

import com.zstrm.scheduler.model.ScheduleMode;
import com.zstrm.scheduler.model.ScheduleRecord;
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
public class ScheduleRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT schedule_id, job_id, starts_at, ends_at, duration_minutes, mode, loop_enabled,
             run_now, created_at, last_run_at
      FROM schedules
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(ScheduleRecord record) {
    final String sql =
        """
        INSERT INTO schedules (
          job_id, starts_at, ends_at, duration_minutes, mode, loop_enabled, run_now, created_at, last_run_at
        ) VALUES (
          :jobId, :startsAt, :endsAt, :durationMinutes, :mode, :loop, :runNow, :createdAt, :lastRunAt
        )
        RETURNING schedule_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", record.jobId())
            .addValue("startsAt", toTimestamp(record.startsAt()))
            .addValue("endsAt", toTimestamp(record.endsAt()))
            .addValue("durationMinutes", record.durationMinutes())
            .addValue("mode", record.mode().name())
            .addValue("loop", record.loop())
            .addValue("runNow", record.runNow())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("lastRunAt", toTimestamp(record.lastRunAt()));
    return jdbcTemplate.queryForObject(sql, params, Long.class);
  }

  public Optional<ScheduleRecord> findById(long scheduleId) {
    final String sql = SELECT_COLUMNS + "WHERE schedule_id = :scheduleId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("scheduleId", scheduleId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<ScheduleRecord> findAll() {
    return jdbcTemplate.query(
        SELECT_COLUMNS + "ORDER BY schedule_id", new MapSqlParameterSource(), this::mapRow);
  }

  public int markRun(long scheduleId, Instant lastRunAt) {
    final String sql =
        """
        UPDATE schedules
        SET last_run_at = :lastRunAt
        WHERE schedule_id = :scheduleId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("scheduleId", scheduleId)
            .addValue("lastRunAt", toTimestamp(lastRunAt));
    return jdbcTemplate.update(sql, params);
  }

  private ScheduleRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ScheduleRecord(
        rs.getLong("schedule_id"),
        rs.getLong("job_id"),
        toInstant(rs.getTimestamp("starts_at")),
        toInstant(rs.getTimestamp("ends_at")),
        rs.getObject("duration_minutes", Integer.class),
        ScheduleMode.valueOf(rs.getString("mode")),
        rs.getBoolean("loop_enabled"),
        rs.getBoolean("run_now"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("last_run_at")));
  }
}

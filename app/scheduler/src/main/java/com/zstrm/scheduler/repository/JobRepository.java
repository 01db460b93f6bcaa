/*
 * Where: scheduler data access
 * What: jobs rows and their status transitions
 * Why: the license gate and session lifecycle both move jobs between states
 */
package com.zstrm.scheduler.repository;

import static com.zstrm.common.JdbcTimestampUtils.toInstant;
import static com.zstrm.common.JdbcTimestampUtils.toTimestamp;

import com.zstrm.scheduler.model.JobRecord;
import com.zstrm.scheduler.model.JobStatus;
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
public class JobRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT job_id, asset_id, destination_id, preset_id, status, invalid_reason,
             created_at, updated_at, requested_at
      FROM jobs
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(JobRecord record) {
    final String sql =
        """
        INSERT INTO jobs (
          asset_id, destination_id, preset_id, status, invalid_reason, created_at, updated_at, requested_at
        ) VALUES (
          :assetId, :destinationId, :presetId, :status, :invalidReason, :createdAt, :updatedAt, :requestedAt
        )
        RETURNING job_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("assetId", record.assetId())
            .addValue("destinationId", record.destinationId())
            .addValue("presetId", record.presetId())
            .addValue("status", record.status().name())
            .addValue("invalidReason", record.invalidReason())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()))
            .addValue("requestedAt", toTimestamp(record.requestedAt()));
    return jdbcTemplate.queryForObject(sql, params, Long.class);
  }

  public Optional<JobRecord> findById(long jobId) {
    final String sql = SELECT_COLUMNS + "WHERE job_id = :jobId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<JobRecord> findAll() {
    return jdbcTemplate.query(
        SELECT_COLUMNS + "ORDER BY job_id", new MapSqlParameterSource(), this::mapRow);
  }

  public List<JobRecord> findByStatus(JobStatus status) {
    final String sql = SELECT_COLUMNS + "WHERE status = :status ORDER BY job_id";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("status", status.name());
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<Long> findIdsByPresetId(long presetId) {
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("presetId", presetId);
    return jdbcTemplate.queryForList(
        "SELECT job_id FROM jobs WHERE preset_id = :presetId ORDER BY job_id", params, Long.class);
  }

  /** Writes status and reason together; {@code invalidReason} must be null unless INVALID. */
  public int updateStatus(long jobId, JobStatus status, String invalidReason, Instant updatedAt) {
    final String sql =
        """
        UPDATE jobs
        SET status = :status,
            invalid_reason = :invalidReason,
            updated_at = :updatedAt
        WHERE job_id = :jobId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("status", status.name())
            .addValue("invalidReason", invalidReason)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  /** Moves the job only if it is still in {@code expected}. */
  public int updateStatusIf(long jobId, JobStatus expected, JobStatus next, Instant updatedAt) {
    final String sql =
        """
        UPDATE jobs
        SET status = :next,
            updated_at = :updatedAt
        WHERE job_id = :jobId
          AND status = :expected
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("expected", expected.name())
            .addValue("next", next.name())
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int countByStatus(JobStatus status) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM jobs WHERE status = :status",
            new MapSqlParameterSource().addValue("status", status.name()),
            Integer.class);
    return count == null ? 0 : count;
  }

  private JobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new JobRecord(
        rs.getLong("job_id"),
        rs.getLong("asset_id"),
        rs.getLong("destination_id"),
        rs.getObject("preset_id", Long.class),
        JobStatus.valueOf(rs.getString("status")),
        rs.getString("invalid_reason"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")),
        toInstant(rs.getTimestamp("requested_at")));
  }
}

/*
 * Where: scheduler data access
 * What: runner_locks lease rows (one per coordinated resource)
 * Why: only one runner may drive the scheduler loop across the fleet
 */
package com.zstrm.scheduler.repository;

import static com.zstrm.common.JdbcTimestampUtils.toInstant;
import static com.zstrm.common.JdbcTimestampUtils.toTimestamp;

import com.zstrm.scheduler.model.LeaseLockRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class LeaseLockRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Inserts or takes over the lock row in a single statement.
   *
   * @return true when the row now belongs to {@code runnerId}
   */
  public boolean tryAcquire(String lockName, String runnerId, Instant now, Instant expiresAt) {
    // the upsert only fires when the current lease is expired or already ours
    final String sql =
        """
        INSERT INTO runner_locks (lock_name, locked_by, locked_at, expires_at)
        VALUES (:lockName, :runnerId, :now, :expiresAt)
        ON CONFLICT (lock_name) DO UPDATE
          SET locked_by  = EXCLUDED.locked_by,
              locked_at  = EXCLUDED.locked_at,
              expires_at = EXCLUDED.expires_at
        WHERE runner_locks.expires_at <= :now
           OR runner_locks.locked_by = :runnerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("lockName", lockName)
            .addValue("runnerId", runnerId)
            .addValue("now", toTimestamp(now))
            .addValue("expiresAt", toTimestamp(expiresAt));
    return jdbcTemplate.update(sql, params) == 1;
  }

  /** Expires the lease immediately if {@code runnerId} still owns it. */
  public int release(String lockName, String runnerId, Instant now) {
    final String sql =
        """
        UPDATE runner_locks
        SET expires_at = :now
        WHERE lock_name = :lockName
          AND locked_by = :runnerId
          AND expires_at > :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("lockName", lockName)
            .addValue("runnerId", runnerId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<LeaseLockRecord> findByName(String lockName) {
    final String sql =
        """
        SELECT lock_name, locked_by, locked_at, expires_at
        FROM runner_locks
        WHERE lock_name = :lockName
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockName", lockName);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private LeaseLockRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new LeaseLockRecord(
        rs.getString("lock_name"),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        toInstant(rs.getTimestamp("expires_at")));
  }
}

/*
 * Where: scheduler data access
 * What: the singleton license_state row
 * Why: license trust survives restarts and is shared by every runner
 */
package com.zstrm.scheduler.repository;

import static com.zstrm.common.JdbcTimestampUtils.toInstant;
import static com.zstrm.common.JdbcTimestampUtils.toTimestamp;

import com.zstrm.scheduler.model.LicenseStateRecord;
import com.zstrm.scheduler.model.LicenseTier;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class LicenseStateRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<LicenseStateRecord> find() {
    final String sql =
        """
        SELECT tier, install_id, install_secret, lease_expires_at, grace_expires_at, last_checked_at
        FROM license_state
        WHERE license_id = 1
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow).stream().findFirst();
  }

  /** Concurrent first starts race here; the loser keeps the winner's install identity. */
  public int insertIfAbsent(LicenseStateRecord record) {
    final String sql =
        """
        INSERT INTO license_state (
          license_id, tier, install_id, install_secret, lease_expires_at, grace_expires_at, last_checked_at
        ) VALUES (
          1, :tier, :installId, :installSecret, :leaseExpiresAt, :graceExpiresAt, :lastCheckedAt
        )
        ON CONFLICT (license_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        stateParams(record)
            .addValue("installId", record.installId())
            .addValue("installSecret", record.installSecret());
    return jdbcTemplate.update(sql, params);
  }

  /** Install identity is immutable; only the trust fields are written. */
  public int update(LicenseStateRecord record) {
    final String sql =
        """
        UPDATE license_state
        SET tier = :tier,
            lease_expires_at = :leaseExpiresAt,
            grace_expires_at = :graceExpiresAt,
            last_checked_at = :lastCheckedAt
        WHERE license_id = 1
        """;
    return jdbcTemplate.update(sql, stateParams(record));
  }

  private MapSqlParameterSource stateParams(LicenseStateRecord record) {
    return new MapSqlParameterSource()
        .addValue("tier", record.tier().name())
        .addValue("leaseExpiresAt", toTimestamp(record.leaseExpiresAt()))
        .addValue("graceExpiresAt", toTimestamp(record.graceExpiresAt()))
        .addValue("lastCheckedAt", toTimestamp(record.lastCheckedAt()));
  }

  private LicenseStateRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new LicenseStateRecord(
        LicenseTier.valueOf(rs.getString("tier")),
        rs.getString("install_id"),
        rs.getString("install_secret"),
        toInstant(rs.getTimestamp("lease_expires_at")),
        toInstant(rs.getTimestamp("grace_expires_at")),
        toInstant(rs.getTimestamp("last_checked_at")));
  }
}

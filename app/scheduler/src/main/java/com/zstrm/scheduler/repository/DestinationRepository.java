package com.zstrm.scheduler.repository;

import static com.zstrm.common.JdbcTimestampUtils.toInstant;
import static com.zstrm.common.JdbcTimestampUtils.toTimestamp;

import com.zstrm.scheduler.model.DestinationRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DestinationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(DestinationRecord record) {
    final String sql =
        """
        INSERT INTO destinations (name, endpoint, stream_key, enabled, created_at)
        VALUES (:name, :endpoint, :streamKey, :enabled, :createdAt)
        RETURNING destination_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", record.name())
            .addValue("endpoint", record.endpoint())
            .addValue("streamKey", record.streamKey())
            .addValue("enabled", record.enabled())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    return jdbcTemplate.queryForObject(sql, params, Long.class);
  }

  public Optional<DestinationRecord> findById(long destinationId) {
    final String sql =
        """
        SELECT destination_id, name, endpoint, stream_key, enabled, created_at
        FROM destinations
        WHERE destination_id = :destinationId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("destinationId", destinationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<DestinationRecord> findAll() {
    final String sql =
        """
        SELECT destination_id, name, endpoint, stream_key, enabled, created_at
        FROM destinations
        ORDER BY destination_id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public int countAll() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM destinations", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  private DestinationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DestinationRecord(
        rs.getLong("destination_id"),
        rs.getString("name"),
        rs.getString("endpoint"),
        rs.getString("stream_key"),
        rs.getBoolean("enabled"),
        toInstant(rs.getTimestamp("created_at")));
  }
}

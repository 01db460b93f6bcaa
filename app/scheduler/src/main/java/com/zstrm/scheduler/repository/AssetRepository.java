package com.zstrm.scheduler.repository;

import static com.zstrm.common.JdbcTimestampUtils.toInstant;
import static com.zstrm.common.JdbcTimestampUtils.toTimestamp;

import com.zstrm.scheduler.model.AssetRecord;
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
public class AssetRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(AssetRecord record) {
    final String sql =
        """
        INSERT INTO assets (
          name, source_url, size_bytes, duration_seconds, thumbnail_path, audio_only, created_at
        ) VALUES (
          :name, :sourceUrl, :sizeBytes, :durationSeconds, :thumbnailPath, :audioOnly, :createdAt
        )
        RETURNING asset_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", record.name())
            .addValue("sourceUrl", record.sourceUrl())
            .addValue("sizeBytes", record.sizeBytes())
            .addValue("durationSeconds", record.durationSeconds())
            .addValue("thumbnailPath", record.thumbnailPath())
            .addValue("audioOnly", record.audioOnly())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    return jdbcTemplate.queryForObject(sql, params, Long.class);
  }

  public Optional<AssetRecord> findById(long assetId) {
    final String sql =
        """
        SELECT asset_id, name, source_url, size_bytes, duration_seconds, thumbnail_path, audio_only, created_at
        FROM assets
        WHERE asset_id = :assetId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("assetId", assetId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** All assets, or those whose name contains {@code query} (case-insensitive). */
  public List<AssetRecord> findAll(String query) {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final StringBuilder sql =
        new StringBuilder(
            """
            SELECT asset_id, name, source_url, size_bytes, duration_seconds, thumbnail_path, audio_only, created_at
            FROM assets
            """);
    if (query != null && !query.isBlank()) {
      sql.append("WHERE name ILIKE :pattern\n");
      params.addValue("pattern", "%" + escapeLike(query.trim()) + "%");
    }
    sql.append("ORDER BY asset_id");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  /** Stores the analysed duration and a thumbnail path after an upload finishes. */
  public int updateMedia(long assetId, Integer durationSeconds, String thumbnailPath) {
    final String sql =
        """
        UPDATE assets
        SET duration_seconds = :durationSeconds,
            thumbnail_path = :thumbnailPath
        WHERE asset_id = :assetId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("assetId", assetId)
            .addValue("durationSeconds", durationSeconds)
            .addValue("thumbnailPath", thumbnailPath);
    return jdbcTemplate.update(sql, params);
  }

  public int countAll() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM assets", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  private AssetRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AssetRecord(
        rs.getLong("asset_id"),
        rs.getString("name"),
        rs.getString("source_url"),
        rs.getObject("size_bytes", Long.class),
        rs.getObject("duration_seconds", Integer.class),
        rs.getString("thumbnail_path"),
        rs.getBoolean("audio_only"),
        toInstant(rs.getTimestamp("created_at")));
  }

  private static String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }
}

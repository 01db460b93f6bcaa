package com.zstrm.scheduler.repository;

import static com.zstrm.common.JdbcTimestampUtils.toInstant;
import static com.zstrm.common.JdbcTimestampUtils.toTimestamp;

import com.zstrm.scheduler.model.AudioReplaceMode;
import com.zstrm.scheduler.model.HotSwapMode;
import com.zstrm.scheduler.model.PresetRecord;
import com.zstrm.scheduler.model.PresetType;
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
public class PresetRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(PresetRecord record) {
    final String sql =
        """
        INSERT INTO presets (
          name, preset_type, video_bitrate, audio_bitrate, force_encode, audio_replace, hot_swap, created_at
        ) VALUES (
          :name, :presetType, :videoBitrate, :audioBitrate, :forceEncode, :audioReplace, :hotSwap, :createdAt
        )
        RETURNING preset_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", record.name())
            .addValue("presetType", record.presetType().name())
            .addValue("videoBitrate", record.videoBitrate())
            .addValue("audioBitrate", record.audioBitrate())
            .addValue("forceEncode", record.forceEncode())
            .addValue("audioReplace", record.audioReplace().name())
            .addValue("hotSwap", record.hotSwap().name())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    return jdbcTemplate.queryForObject(sql, params, Long.class);
  }

  public Optional<PresetRecord> findById(long presetId) {
    final String sql =
        """
        SELECT preset_id, name, preset_type, video_bitrate, audio_bitrate, force_encode,
               audio_replace, hot_swap, created_at
        FROM presets
        WHERE preset_id = :presetId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("presetId", presetId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<PresetRecord> findAll() {
    final String sql =
        """
        SELECT preset_id, name, preset_type, video_bitrate, audio_bitrate, force_encode,
               audio_replace, hot_swap, created_at
        FROM presets
        ORDER BY preset_id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  /** Jobs referencing the preset keep their row with preset_id set to NULL. */
  public int deleteById(long presetId) {
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("presetId", presetId);
    return jdbcTemplate.update("DELETE FROM presets WHERE preset_id = :presetId", params);
  }

  public int countAll() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM presets", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  private PresetRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new PresetRecord(
        rs.getLong("preset_id"),
        rs.getString("name"),
        PresetType.valueOf(rs.getString("preset_type")),
        rs.getObject("video_bitrate", Integer.class),
        rs.getObject("audio_bitrate", Integer.class),
        rs.getBoolean("force_encode"),
        AudioReplaceMode.valueOf(rs.getString("audio_replace")),
        HotSwapMode.valueOf(rs.getString("hot_swap")),
        toInstant(rs.getTimestamp("created_at")));
  }
}

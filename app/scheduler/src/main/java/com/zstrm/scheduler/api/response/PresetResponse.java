package com.zstrm.scheduler.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.zstrm.scheduler.model.PresetRecord;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PresetResponse(
    long presetId,
    String name,
    String presetType,
    Integer videoBitrate,
    Integer audioBitrate,
    boolean forceEncode,
    String audioReplace,
    String hotSwap,
    Instant createdAt) {

  public static PresetResponse from(PresetRecord record) {
    return new PresetResponse(
        record.presetId(),
        record.name(),
        record.presetType().name(),
        record.videoBitrate(),
        record.audioBitrate(),
        record.forceEncode(),
        record.audioReplace().name(),
        record.hotSwap().name(),
        record.createdAt());
  }
}

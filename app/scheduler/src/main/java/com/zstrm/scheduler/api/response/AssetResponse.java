package com.zstrm.scheduler.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.zstrm.scheduler.model.AssetRecord;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AssetResponse(
    long assetId,
    String name,
    String sourceUrl,
    Long sizeBytes,
    Integer durationSeconds,
    String thumbnailPath,
    boolean audioOnly,
    Instant createdAt) {

  public static AssetResponse from(AssetRecord record) {
    return new AssetResponse(
        record.assetId(),
        record.name(),
        record.sourceUrl(),
        record.sizeBytes(),
        record.durationSeconds(),
        record.thumbnailPath(),
        record.audioOnly(),
        record.createdAt());
  }
}

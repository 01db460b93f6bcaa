package com.zstrm.scheduler.model;

import java.time.Instant;

public record AssetRecord(
    Long assetId,
    String name,
    String sourceUrl,
    Long sizeBytes,
    Integer durationSeconds,
    String thumbnailPath,
    boolean audioOnly,
    Instant createdAt) {}

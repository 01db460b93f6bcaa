package com.zstrm.scheduler.model;

import java.time.Instant;

public record JobRecord(
    Long jobId,
    Long assetId,
    Long destinationId,
    Long presetId,
    JobStatus status,
    String invalidReason,
    Instant createdAt,
    Instant updatedAt,
    Instant requestedAt) {}

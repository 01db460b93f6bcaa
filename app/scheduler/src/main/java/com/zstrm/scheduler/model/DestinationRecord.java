package com.zstrm.scheduler.model;

import java.time.Instant;

public record DestinationRecord(
    Long destinationId,
    String name,
    String endpoint,
    String streamKey,
    boolean enabled,
    Instant createdAt) {}

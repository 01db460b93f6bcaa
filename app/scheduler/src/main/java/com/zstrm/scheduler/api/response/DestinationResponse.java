package com.zstrm.scheduler.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.zstrm.scheduler.model.DestinationRecord;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DestinationResponse(
    long destinationId,
    String name,
    String endpoint,
    String streamKey,
    boolean enabled,
    Instant createdAt) {

  public static DestinationResponse from(DestinationRecord record) {
    return new DestinationResponse(
        record.destinationId(),
        record.name(),
        record.endpoint(),
        record.streamKey(),
        record.enabled(),
        record.createdAt());
  }
}

package com.zstrm.scheduler.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.zstrm.scheduler.model.SessionRecord;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SessionResponse(
    long sessionId,
    long scheduleId,
    long jobId,
    Instant startedAt,
    Instant endedAt,
    String status,
    String pipelineDescription,
    String reason) {

  public static SessionResponse from(SessionRecord record) {
    return new SessionResponse(
        record.sessionId(),
        record.scheduleId(),
        record.jobId(),
        record.startedAt(),
        record.endedAt(),
        record.status().name(),
        record.pipelineDescription(),
        record.reason());
  }
}

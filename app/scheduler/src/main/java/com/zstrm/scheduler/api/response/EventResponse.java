package com.zstrm.scheduler.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.zstrm.scheduler.model.EventLogRecord;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EventResponse(
    long eventId,
    Long sessionId,
    Long jobId,
    Long scheduleId,
    String eventType,
    String message,
    Instant createdAt) {

  public static EventResponse from(EventLogRecord record) {
    return new EventResponse(
        record.eventId(),
        record.sessionId(),
        record.jobId(),
        record.scheduleId(),
        record.eventType().name(),
        record.message(),
        record.createdAt());
  }
}

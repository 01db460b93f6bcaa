package com.zstrm.scheduler.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.zstrm.scheduler.model.ScheduleRecord;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduleResponse(
    long scheduleId,
    long jobId,
    Instant startsAt,
    Instant endsAt,
    Integer durationMinutes,
    String mode,
    boolean loop,
    boolean runNow,
    Instant createdAt,
    Instant lastRunAt) {

  public static ScheduleResponse from(ScheduleRecord record) {
    return new ScheduleResponse(
        record.scheduleId(),
        record.jobId(),
        record.startsAt(),
        record.endsAt(),
        record.durationMinutes(),
        record.mode().name(),
        record.loop(),
        record.runNow(),
        record.createdAt(),
        record.lastRunAt());
  }
}

package com.zstrm.scheduler.model;

import java.time.Instant;

public record SessionRecord(
    Long sessionId,
    Long scheduleId,
    Long jobId,
    Instant startedAt,
    Instant endedAt,
    JobStatus status,
    String pipelineDescription,
    String reason) {

  public boolean isEnded() {
    return endedAt != null;
  }
}

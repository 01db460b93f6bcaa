/*
 * Where: scheduler domain model
 * What: one append-only audit entry
 * Why: events and session/job status are the only state external monitors read
 */
package com.zstrm.scheduler.model;

import java.time.Instant;

public record EventLogRecord(
    Long eventId,
    Long sessionId,
    Long jobId,
    Long scheduleId,
    EventType eventType,
    String message,
    Instant createdAt) {

  public static EventLogRecord of(
      Long sessionId, Long jobId, Long scheduleId, EventType eventType, String message) {
    return new EventLogRecord(null, sessionId, jobId, scheduleId, eventType, message, null);
  }

  public static EventLogRecord license(EventType eventType, String message) {
    return of(null, null, null, eventType, message);
  }
}

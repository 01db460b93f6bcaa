/*
 * Where: scheduler domain model
 * What: snapshot of a schedules row
 * Why: the evaluator decides due-ness and validity from this snapshot alone
 */
package com.zstrm.scheduler.model;

import java.time.Duration;
import java.time.Instant;

public record ScheduleRecord(
    Long scheduleId,
    Long jobId,
    Instant startsAt,
    Instant endsAt,
    Integer durationMinutes,
    ScheduleMode mode,
    boolean loop,
    boolean runNow,
    Instant createdAt,
    Instant lastRunAt) {

  /** starts_at + duration_minutes, where a missing duration counts as zero minutes. */
  public Instant plannedEnd() {
    return startsAt.plus(Duration.ofMinutes(hasDuration() ? durationMinutes : 0));
  }

  /** A null or zero duration is treated as not configured. */
  public boolean hasDuration() {
    return durationMinutes != null && durationMinutes > 0;
  }
}

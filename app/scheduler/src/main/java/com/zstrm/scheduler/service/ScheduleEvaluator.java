/*
 * Where: scheduler service layer
 * What: decides whether a schedule is invalid, due or not due at a given instant
 * Why: due-ness and tier gating stay a pure function the loop and run-now share
 */
package com.zstrm.scheduler.service;

import com.zstrm.scheduler.model.LicenseTier;
import com.zstrm.scheduler.model.ScheduleDecision;
import com.zstrm.scheduler.model.ScheduleMode;
import com.zstrm.scheduler.model.ScheduleRecord;
import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Component;

@Component
public class ScheduleEvaluator {

  public static final String REASON_LOOP_REQUIRED = "Loop required when window exceeds duration";
  public static final String REASON_LOOP_TIER = "Looped windows require Premium or above";

  /** Validation first, then license gating, then due-ness. */
  public ScheduleDecision evaluate(ScheduleRecord schedule, LicenseTier tier, Instant now) {
    if (requiresLoop(schedule)) {
      return ScheduleDecision.invalid(REASON_LOOP_REQUIRED);
    }
    if (tier == LicenseTier.BASIC && schedule.loop() && schedule.mode() == ScheduleMode.WINDOWED) {
      return ScheduleDecision.invalid(REASON_LOOP_TIER);
    }
    return shouldRun(schedule, now) ? ScheduleDecision.run() : ScheduleDecision.skip();
  }

  public boolean shouldRun(ScheduleRecord schedule, Instant now) {
    return !schedule.startsAt().isAfter(now)
        && !pastEnd(schedule, now)
        && !windowOutlastsPlan(schedule);
  }

  /** A failed attempt may be retried while the schedule's end bounds have not passed. */
  public boolean withinRetryWindow(ScheduleRecord schedule, Instant now) {
    return !pastEnd(schedule, now);
  }

  private boolean pastEnd(ScheduleRecord schedule, Instant now) {
    if (schedule.endsAt() != null && now.isAfter(schedule.endsAt())) {
      return true;
    }
    if (schedule.mode() == ScheduleMode.ONE_TIME) {
      return false;
    }
    return now.isAfter(schedule.plannedEnd()) && !schedule.loop();
  }

  // reached only when validation was skipped, i.e. no usable duration
  private boolean windowOutlastsPlan(ScheduleRecord schedule) {
    return schedule.mode() == ScheduleMode.WINDOWED
        && !schedule.loop()
        && schedule.endsAt() != null
        && schedule.endsAt().isAfter(schedule.plannedEnd());
  }

  private boolean requiresLoop(ScheduleRecord schedule) {
    if (schedule.mode() != ScheduleMode.WINDOWED
        || schedule.endsAt() == null
        || !schedule.hasDuration()
        || schedule.loop()) {
      return false;
    }
    final Duration window = Duration.between(schedule.startsAt(), schedule.endsAt());
    return window.compareTo(Duration.ofMinutes(schedule.durationMinutes())) > 0;
  }
}

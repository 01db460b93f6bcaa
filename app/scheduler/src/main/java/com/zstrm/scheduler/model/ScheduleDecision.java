/*
 * Where: scheduler domain model
 * What: outcome of evaluating one schedule at one instant
 * Why: keeps the evaluator a pure function whose result the processor acts on
 */
package com.zstrm.scheduler.model;

public record ScheduleDecision(Outcome outcome, String reason) {

  public enum Outcome {
    SKIP,
    INVALID,
    RUN
  }

  private static final ScheduleDecision SKIP = new ScheduleDecision(Outcome.SKIP, null);
  private static final ScheduleDecision RUN = new ScheduleDecision(Outcome.RUN, null);

  public static ScheduleDecision skip() {
    return SKIP;
  }

  public static ScheduleDecision run() {
    return RUN;
  }

  public static ScheduleDecision invalid(String reason) {
    return new ScheduleDecision(Outcome.INVALID, reason);
  }
}

package com.zstrm.scheduler.model;

/** Result reported for one session by the pipeline executor. */
public record ExecutionOutcome(boolean success, String reason) {

  public static ExecutionOutcome succeeded() {
    return new ExecutionOutcome(true, null);
  }

  public static ExecutionOutcome failed(String reason) {
    return new ExecutionOutcome(false, reason);
  }
}

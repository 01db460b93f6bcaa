/*
 * Where: scheduler API
 * What: a run-now request that did not start a session
 * Why: an invalid or gated job is a conflict with current state, not a server error
 */
package com.zstrm.scheduler.api;

public class RunNowConflictException extends RuntimeException {

  public RunNowConflictException(String message) {
    super(message);
  }
}

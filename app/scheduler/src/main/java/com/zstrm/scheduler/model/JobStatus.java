/*
 * Where: scheduler domain model
 * What: job and session lifecycle states
 * Why: sessions reuse the RUNNING/COMPLETED/FAILED subset so both tables share one vocabulary
 */
package com.zstrm.scheduler.model;

public enum JobStatus {
  PENDING,
  RUNNING,
  FAILED,
  COMPLETED,
  CANCELLED,
  INVALID
}

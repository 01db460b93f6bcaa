package com.zstrm.scheduler.model;

import java.time.Instant;

public record LeaseLockRecord(String lockName, String lockedBy, Instant lockedAt, Instant expiresAt) {

  public boolean isFreeFor(String runnerId, Instant now) {
    return !now.isBefore(expiresAt) || lockedBy.equals(runnerId);
  }
}

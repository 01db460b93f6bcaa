/*
 * Where: scheduler domain model
 * What: snapshot of the singleton license_state row
 * Why: the state machine works on immutable snapshots and the repository persists the result
 */
package com.zstrm.scheduler.model;

import java.time.Instant;

public record LicenseStateRecord(
    LicenseTier tier,
    String installId,
    String installSecret,
    Instant leaseExpiresAt,
    Instant graceExpiresAt,
    Instant lastCheckedAt) {

  public LicenseStatus statusAt(Instant now) {
    if (now.isBefore(leaseExpiresAt)) {
      return LicenseStatus.TRUSTED;
    }
    if (graceExpiresAt != null && now.isBefore(graceExpiresAt)) {
      return LicenseStatus.GRACE;
    }
    return LicenseStatus.DEGRADED;
  }

  /** Stored tier while trusted or in grace, BASIC once degraded. Never mutates. */
  public LicenseTier effectiveTier(Instant now) {
    return statusAt(now) == LicenseStatus.DEGRADED ? LicenseTier.BASIC : tier;
  }

  public boolean leaseExpired(Instant now) {
    return !now.isBefore(leaseExpiresAt);
  }
}

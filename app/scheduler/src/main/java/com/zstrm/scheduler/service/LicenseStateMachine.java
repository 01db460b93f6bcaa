/*
 * Where: scheduler service layer
 * What: pure transitions of the license state record
 * Why: renewal and downgrade rules are testable without a clock, database or network
 */
package com.zstrm.scheduler.service;

import com.zstrm.scheduler.config.LicensingProperties;
import com.zstrm.scheduler.model.LicenseStateRecord;
import com.zstrm.scheduler.model.LicenseTier;
import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Component;

@Component
public class LicenseStateMachine {

  private final Duration leaseDuration;
  private final Duration graceDuration;

  public LicenseStateMachine(LicensingProperties properties) {
    this.leaseDuration = properties.leaseDuration();
    this.graceDuration = properties.graceDuration();
  }

  /** Authority confirmed {@code tier}: new lease, grace cleared. */
  public LicenseStateRecord renewSucceeded(LicenseStateRecord state, LicenseTier tier, Instant now) {
    return new LicenseStateRecord(
        tier,
        state.installId(),
        state.installSecret(),
        now.plus(leaseDuration),
        null,
        now);
  }

  /** Authority unreachable: tier kept, grace window restarted from now. */
  public LicenseStateRecord renewFailed(LicenseStateRecord state, Instant now) {
    return new LicenseStateRecord(
        state.tier(),
        state.installId(),
        state.installSecret(),
        state.leaseExpiresAt(),
        now.plus(graceDuration),
        now);
  }

  /** Stored tier drops to BASIC; lease stays expired so the effective tier stays BASIC. */
  public LicenseStateRecord forcedDowngrade(LicenseStateRecord state, Instant now) {
    return new LicenseStateRecord(
        LicenseTier.BASIC,
        state.installId(),
        state.installSecret(),
        state.leaseExpiresAt(),
        now.plus(graceDuration),
        state.lastCheckedAt());
  }
}

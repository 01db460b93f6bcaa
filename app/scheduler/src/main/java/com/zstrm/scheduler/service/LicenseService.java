/*
 * Where: scheduler service layer
 * What: applies license transitions, records their events and cascades downgrades to jobs
 * Why: every tier change must be persisted, audited and reflected in job validity
 */
package com.zstrm.scheduler.service;

import com.zstrm.scheduler.model.EventLogRecord;
import com.zstrm.scheduler.model.EventType;
import com.zstrm.scheduler.model.LicenseStateRecord;
import com.zstrm.scheduler.model.LicenseTier;
import com.zstrm.scheduler.repository.EventLogRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class LicenseService {

  private static final Logger logger = LoggerFactory.getLogger(LicenseService.class);

  private final LicenseStateStore licenseStateStore;
  private final LicenseStateMachine stateMachine;
  private final EventLogRepository eventLogRepository;
  private final JobReevaluator jobReevaluator;
  private final SchedulerMetrics metrics;
  private final Clock clock;

  public LicenseStateRecord currentState() {
    return licenseStateStore.load();
  }

  public LicenseTier currentTier() {
    final LicenseTier tier = licenseStateStore.currentTier();
    metrics.updateEffectiveTier(tier);
    return tier;
  }

  /**
   * Records a successful renewal.
   *
   * @param confirmedTier tier reported by the authority, or null to keep the stored tier
   */
  @Transactional
  public LicenseStateRecord applyRenewal(LicenseTier confirmedTier) {
    final Instant now = Instant.now(clock);
    final LicenseStateRecord state = licenseStateStore.load();
    final LicenseTier tier = confirmedTier == null ? state.tier() : confirmedTier;
    final LicenseStateRecord renewed = stateMachine.renewSucceeded(state, tier, now);
    licenseStateStore.save(renewed);
    eventLogRepository.append(
        EventLogRecord.license(
            EventType.UPGRADED, "License renewed tier=" + tier.value() + " at " + now),
        now);
    metrics.updateEffectiveTier(tier);
    logger.info("license renewed tier={} leaseExpiresAt={}", tier, renewed.leaseExpiresAt());
    return renewed;
  }

  @Transactional
  public LicenseStateRecord applyRenewalFailure(String cause) {
    final Instant now = Instant.now(clock);
    final LicenseStateRecord failed = stateMachine.renewFailed(licenseStateStore.load(), now);
    licenseStateStore.save(failed);
    eventLogRepository.append(
        EventLogRecord.license(
            EventType.DOWNGRADED, "License renewal failed at " + now + ": " + cause),
        now);
    logger.warn(
        "license renewal failed tier={} graceExpiresAt={} cause={}",
        failed.tier(),
        failed.graceExpiresAt(),
        cause);
    return failed;
  }

  /** Forces a downgrade once the effective tier has fallen to BASIC but the stored tier has not. */
  @Transactional
  public boolean downgradeIfNeeded() {
    final LicenseStateRecord state = licenseStateStore.load();
    final Instant now = Instant.now(clock);
    if (state.effectiveTier(now) != LicenseTier.BASIC || state.tier() == LicenseTier.BASIC) {
      return false;
    }
    forceDowngrade("Automatic downgrade after grace window");
    return true;
  }

  /**
   * Drops the stored tier to BASIC and re-evaluates every job.
   *
   * @return false when the stored tier already was BASIC
   */
  @Transactional
  public boolean forceDowngrade(String message) {
    final Instant now = Instant.now(clock);
    final LicenseStateRecord state = licenseStateStore.load();
    if (state.tier() == LicenseTier.BASIC) {
      return false;
    }
    licenseStateStore.save(stateMachine.forcedDowngrade(state, now));
    eventLogRepository.append(EventLogRecord.license(EventType.DOWNGRADED, message), now);
    metrics.updateEffectiveTier(LicenseTier.BASIC);
    logger.warn("license downgraded from={} message={}", state.tier(), message);
    jobReevaluator.reevaluateAll();
    return true;
  }
}

/*
 * Where: scheduler service layer
 * What: one renewal cycle of the license lease against the authority
 * Why: a failed renewal must degrade trust gradually instead of dropping the tier at once
 */
package com.zstrm.scheduler.service;

import com.google.common.annotations.VisibleForTesting;
import com.zstrm.scheduler.config.LicensingProperties;
import com.zstrm.scheduler.model.LicenseStateRecord;
import com.zstrm.scheduler.model.LicenseTier;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LicenseRenewalService {

  private static final Logger logger = LoggerFactory.getLogger(LicenseRenewalService.class);

  private final LicenseService licenseService;
  private final LicenseAuthorityClient authorityClient;
  private final LicensingProperties properties;
  private final SchedulerMetrics metrics;
  private final Clock clock;

  // only touched from the renewal task
  private Instant retryDeadline;

  /**
   * Runs one renewal attempt.
   *
   * @return delay until the next attempt: the lease duration on success, the retry backoff on
   *     failure
   */
  public Duration renewCycle() {
    final Instant now = Instant.now(clock);
    if (retryDeadline == null) {
      retryDeadline = now.plus(properties.retryWindow());
    }
    final LicenseStateRecord state = licenseService.currentState();
    if (state.leaseExpired(now)) {
      licenseService.downgradeIfNeeded();
    }
    try {
      final LicenseTier tier = authorityClient.renew(state.installId(), state.installSecret());
      licenseService.applyRenewal(tier);
      retryDeadline = Instant.now(clock).plus(properties.retryWindow());
      metrics.recordRenewal("success");
      return properties.leaseDuration();
    } catch (LicenseAuthorityException ex) {
      logger.warn("license renewal attempt failed reason={}", ex.reason(), ex);
      licenseService.applyRenewalFailure(ex.getMessage());
      metrics.recordRenewal("failure");
      if (Instant.now(clock).isAfter(retryDeadline)
          && licenseService.forceDowngrade("Automatic downgrade after retry window")) {
        metrics.recordRenewal("downgraded");
      }
      return properties.retryBackoff();
    }
  }

  @VisibleForTesting
  Instant retryDeadline() {
    return retryDeadline;
  }
}

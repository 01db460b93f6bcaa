/*
 * Where: scheduler service tests
 * What: one renewal cycle against a stubbed authority
 * Why: the next delay and the retry-window downgrade decide how fast trust decays
 */
package com.zstrm.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.zstrm.scheduler.model.LicenseStateRecord;
import com.zstrm.scheduler.model.LicenseTier;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LicenseRenewalServiceTest {

  private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private LicenseService licenseService;
  @Mock private LicenseAuthorityClient authorityClient;
  @Mock private SchedulerMetrics metrics;

  private MutableClock clock;
  private LicenseRenewalService service;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    service =
        new LicenseRenewalService(
            licenseService, authorityClient, LicenseStateMachineTest.PROPERTIES, metrics, clock);
  }

  @Test
  void successReturnsLeaseDurationAndResetsRetryDeadline() {
    when(licenseService.currentState()).thenReturn(state(START.plus(Duration.ofMinutes(10))));
    when(authorityClient.renew("install-1", "secret-1")).thenReturn(LicenseTier.PREMIUM);

    final Duration next = service.renewCycle();

    assertThat(next).isEqualTo(Duration.ofHours(1));
    assertThat(service.retryDeadline()).isEqualTo(START.plus(Duration.ofMinutes(30)));
    verify(licenseService).applyRenewal(LicenseTier.PREMIUM);
    verify(licenseService, never()).downgradeIfNeeded();
    verify(metrics).recordRenewal("success");
  }

  @Test
  void failureWithinRetryWindowReturnsBackoffWithoutDowngrade() {
    when(licenseService.currentState()).thenReturn(state(START.plus(Duration.ofMinutes(10))));
    when(authorityClient.renew("install-1", "secret-1")).thenThrow(timeout());

    final Duration next = service.renewCycle();

    assertThat(next).isEqualTo(Duration.ofMinutes(5));
    verify(licenseService).applyRenewalFailure("license renew timeout");
    verify(licenseService, never()).forceDowngrade(anyString());
    verify(metrics).recordRenewal("failure");
  }

  @Test
  void failurePastRetryWindowForcesDowngrade() {
    when(licenseService.currentState()).thenReturn(state(START.plus(Duration.ofHours(2))));
    when(authorityClient.renew("install-1", "secret-1")).thenThrow(timeout());
    when(licenseService.forceDowngrade(anyString())).thenReturn(true);

    service.renewCycle();
    clock.advance(Duration.ofMinutes(31));
    final Duration next = service.renewCycle();

    assertThat(next).isEqualTo(Duration.ofMinutes(5));
    verify(licenseService).forceDowngrade("Automatic downgrade after retry window");
    verify(metrics).recordRenewal("downgraded");
  }

  @Test
  void expiredLeaseChecksForDowngradeBeforeCallingAuthority() {
    when(licenseService.currentState()).thenReturn(state(START.minusSeconds(1)));
    when(authorityClient.renew("install-1", "secret-1")).thenReturn(null);

    service.renewCycle();

    verify(licenseService).downgradeIfNeeded();
    verify(licenseService).applyRenewal(null);
  }

  private static LicenseAuthorityException timeout() {
    return new LicenseAuthorityException(
        LicenseAuthorityException.Reason.TIMEOUT, "license renew timeout");
  }

  private static LicenseStateRecord state(Instant leaseExpiresAt) {
    return new LicenseStateRecord(
        LicenseTier.PREMIUM, "install-1", "secret-1", leaseExpiresAt, null, START);
  }

  private static final class MutableClock extends Clock {

    private Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}

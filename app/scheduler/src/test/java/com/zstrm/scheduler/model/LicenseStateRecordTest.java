package com.zstrm.scheduler.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class LicenseStateRecordTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Test
  void trustedWhileLeaseIsValid() {
    final LicenseStateRecord state = state(NOW.plusSeconds(1), null);

    assertThat(state.statusAt(NOW)).isEqualTo(LicenseStatus.TRUSTED);
    assertThat(state.effectiveTier(NOW)).isEqualTo(LicenseTier.ULTIMATE);
    assertThat(state.leaseExpired(NOW)).isFalse();
  }

  @Test
  void graceKeepsStoredTier() {
    final LicenseStateRecord state = state(NOW, NOW.plus(Duration.ofHours(1)));

    assertThat(state.statusAt(NOW)).isEqualTo(LicenseStatus.GRACE);
    assertThat(state.effectiveTier(NOW)).isEqualTo(LicenseTier.ULTIMATE);
    assertThat(state.leaseExpired(NOW)).isTrue();
  }

  @Test
  void degradedReportsBasicWithoutChangingStoredTier() {
    final LicenseStateRecord state = state(NOW.minusSeconds(10), NOW);

    assertThat(state.statusAt(NOW)).isEqualTo(LicenseStatus.DEGRADED);
    assertThat(state.effectiveTier(NOW)).isEqualTo(LicenseTier.BASIC);
    assertThat(state.tier()).isEqualTo(LicenseTier.ULTIMATE);
  }

  @Test
  void expiredLeaseWithoutGraceIsDegraded() {
    assertThat(state(NOW.minusSeconds(1), null).statusAt(NOW)).isEqualTo(LicenseStatus.DEGRADED);
  }

  @Test
  void tierParsingAndOrdering() {
    assertThat(LicenseTier.fromValue(" Premium ")).isEqualTo(LicenseTier.PREMIUM);
    assertThat(LicenseTier.ULTIMATE.isAtLeast(LicenseTier.PREMIUM)).isTrue();
    assertThat(LicenseTier.BASIC.isAtLeast(LicenseTier.PREMIUM)).isFalse();
    assertThat(LicenseTier.PREMIUM.value()).isEqualTo("premium");
    assertThatThrownBy(() -> LicenseTier.fromValue("gold"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static LicenseStateRecord state(Instant leaseExpiresAt, Instant graceExpiresAt) {
    return new LicenseStateRecord(
        LicenseTier.ULTIMATE, "install-1", "secret-1", leaseExpiresAt, graceExpiresAt, NOW);
  }
}

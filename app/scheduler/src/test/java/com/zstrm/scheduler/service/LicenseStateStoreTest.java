package com.zstrm.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.zstrm.scheduler.config.LicensingProperties;
import com.zstrm.scheduler.model.LicenseStateRecord;
import com.zstrm.scheduler.model.LicenseTier;
import com.zstrm.scheduler.repository.LicenseStateRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LicenseStateStoreTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private LicenseStateRepository licenseStateRepository;

  @Test
  void firstLoadCreatesBasicStateWithGeneratedIdentity() {
    final LicenseStateStore store = store(null);
    final ArgumentCaptor<LicenseStateRecord> inserted =
        ArgumentCaptor.forClass(LicenseStateRecord.class);
    when(licenseStateRepository.find())
        .thenReturn(Optional.empty())
        .thenAnswer(invocation -> Optional.of(inserted.getValue()));
    when(licenseStateRepository.insertIfAbsent(inserted.capture())).thenReturn(1);

    final LicenseStateRecord state = store.load();

    assertThat(state.tier()).isEqualTo(LicenseTier.BASIC);
    assertThat(state.installId()).isNotBlank();
    assertThat(state.installSecret()).isNotBlank().isNotEqualTo(state.installId());
    assertThat(state.leaseExpiresAt()).isEqualTo(NOW);
  }

  @Test
  void currentTierProjectsDegradedStateToBasic() {
    when(licenseStateRepository.find())
        .thenReturn(
            Optional.of(
                new LicenseStateRecord(
                    LicenseTier.ULTIMATE, "i", "s", NOW.minus(Duration.ofHours(1)), null, NOW)));

    assertThat(store("install-1").currentTier()).isEqualTo(LicenseTier.BASIC);
  }

  @Test
  void saveFailsWhenRowIsMissing() {
    final LicenseStateRecord state =
        new LicenseStateRecord(LicenseTier.BASIC, "i", "s", NOW, null, NOW);
    when(licenseStateRepository.update(state)).thenReturn(0);

    assertThatThrownBy(() -> store("install-1").save(state))
        .isInstanceOf(IllegalStateException.class);
    verify(licenseStateRepository).update(state);
  }

  private LicenseStateStore store(String installId) {
    final LicensingProperties properties =
        new LicensingProperties(
            true,
            "http://licensing.test",
            "/v1/licenses/renew",
            installId,
            null,
            Duration.ofSeconds(5),
            Duration.ofHours(1),
            Duration.ofHours(6),
            Duration.ofMinutes(5),
            Duration.ofMinutes(30));
    return new LicenseStateStore(
        licenseStateRepository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
  }
}

/*
 * Where: scheduler service layer
 * What: loads (creating on first use) and saves the singleton license state
 * Why: both the license lifecycle and the job gate read the tier from one place
 */
package com.zstrm.scheduler.service;

import com.zstrm.scheduler.config.LicensingProperties;
import com.zstrm.scheduler.model.LicenseStateRecord;
import com.zstrm.scheduler.model.LicenseTier;
import com.zstrm.scheduler.repository.LicenseStateRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LicenseStateStore {

  private static final Logger logger = LoggerFactory.getLogger(LicenseStateStore.class);

  private final LicenseStateRepository licenseStateRepository;
  private final LicensingProperties properties;
  private final Clock clock;

  public LicenseStateRecord load() {
    return licenseStateRepository.find().orElseGet(this::createInitial);
  }

  /** Stored tier while trusted or in grace, BASIC once degraded. */
  public LicenseTier currentTier() {
    return load().effectiveTier(Instant.now(clock));
  }

  public void save(LicenseStateRecord state) {
    final int updated = licenseStateRepository.update(state);
    if (updated == 0) {
      throw new IllegalStateException("license state row is missing");
    }
  }

  private LicenseStateRecord createInitial() {
    final Instant now = Instant.now(clock);
    final LicenseStateRecord initial =
        new LicenseStateRecord(
            LicenseTier.BASIC,
            orRandom(properties.installId()),
            orRandom(properties.installSecret()),
            now,
            null,
            now);
    if (licenseStateRepository.insertIfAbsent(initial) > 0) {
      logger.info("license state initialized installId={}", initial.installId());
    }
    return licenseStateRepository
        .find()
        .orElseThrow(() -> new IllegalStateException("license state row could not be created"));
  }

  private static String orRandom(String value) {
    return value == null || value.isBlank() ? UUID.randomUUID().toString() : value;
  }
}

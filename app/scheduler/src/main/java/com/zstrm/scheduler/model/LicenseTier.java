/*
 * Where: scheduler domain model
 * What: ordered license tiers that gate preset and schedule features
 * Why: feature checks compare tiers by rank rather than by name
 */
package com.zstrm.scheduler.model;

import java.util.Locale;

public enum LicenseTier {
  BASIC,
  PREMIUM,
  ULTIMATE;

  public boolean isAtLeast(LicenseTier other) {
    return compareTo(other) >= 0;
  }

  /** Parses the licensing authority's lower-case tier names. */
  public static LicenseTier fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("tier is required");
    }
    return LicenseTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}

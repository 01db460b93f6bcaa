/*
 * Where: scheduler API response DTO
 * What: stored and effective license tier with the lease and grace deadlines
 * Why: operators see how long the current tier stays trusted; the install secret is never returned
 */
package com.zstrm.scheduler.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LicenseResponse(
    String tier,
    String effectiveTier,
    String status,
    String installId,
    Instant leaseExpiresAt,
    Instant graceExpiresAt,
    Instant lastCheckedAt) {}

/*
 * Where: scheduler API request DTO
 * What: input of POST /v1/jobs
 * Why: a job binds an asset to a destination through a preset
 */
package com.zstrm.scheduler.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateJobRequest(
    @NotNull Long assetId, @NotNull Long destinationId, @NotNull Long presetId, Instant requestedAt) {}

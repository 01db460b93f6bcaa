/*
 * Where: scheduler API request DTO
 * What: input of POST /v1/assets
 * Why: media metadata is registered before any job can reference it
 */
package com.zstrm.scheduler.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateAssetRequest(
    @NotBlank String name,
    String sourceUrl,
    @PositiveOrZero Long sizeBytes,
    @PositiveOrZero Integer durationSeconds,
    String thumbnailPath,
    Boolean audioOnly) {}

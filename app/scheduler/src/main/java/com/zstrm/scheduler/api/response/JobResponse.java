/*
 * Where: scheduler API response DTO
 * What: a job with its status and, when INVALID, the reason
 * Why: clients see why a job will not run without reading the event log
 */
package com.zstrm.scheduler.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.zstrm.scheduler.model.JobRecord;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobResponse(
    long jobId,
    long assetId,
    long destinationId,
    Long presetId,
    String status,
    String invalidReason,
    Instant requestedAt,
    Instant createdAt,
    Instant updatedAt) {

  public static JobResponse from(JobRecord record) {
    return new JobResponse(
        record.jobId(),
        record.assetId(),
        record.destinationId(),
        record.presetId(),
        record.status().name(),
        record.invalidReason(),
        record.requestedAt(),
        record.createdAt(),
        record.updatedAt());
  }
}

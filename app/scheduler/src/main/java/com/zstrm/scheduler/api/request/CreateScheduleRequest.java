/*
 * Where: scheduler API request DTO
 * What: input of POST /v1/schedules
 * Why: mode defaults to ONE_TIME; run_now processes the schedule right after it is stored
 */
package com.zstrm.scheduler.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.zstrm.scheduler.model.ScheduleMode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateScheduleRequest(
    @NotNull Long jobId,
    @NotNull Instant startsAt,
    Instant endsAt,
    @Positive Integer durationMinutes,
    ScheduleMode mode,
    Boolean loop,
    Boolean runNow) {}

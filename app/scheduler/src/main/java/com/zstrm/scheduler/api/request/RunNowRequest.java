package com.zstrm.scheduler.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;

/** Without a schedule id an ad-hoc one-time schedule starting now is created. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunNowRequest(@NotNull Long jobId, Long scheduleId) {}

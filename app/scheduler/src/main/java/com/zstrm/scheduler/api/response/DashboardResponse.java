package com.zstrm.scheduler.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Row counts; {@code streams} counts every session ever started. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DashboardResponse(
    int streams, int assets, int destinations, int presets, int activeSessions, int invalidJobs) {}

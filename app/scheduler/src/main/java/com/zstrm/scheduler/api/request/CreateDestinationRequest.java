package com.zstrm.scheduler.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateDestinationRequest(
    @NotBlank String name, @NotBlank String endpoint, String streamKey, Boolean enabled) {}

package com.zstrm.scheduler.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.zstrm.scheduler.model.AudioReplaceMode;
import com.zstrm.scheduler.model.HotSwapMode;
import com.zstrm.scheduler.model.PresetType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/** Omitted enums default to COPY / NONE / NONE. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreatePresetRequest(
    @NotBlank String name,
    PresetType presetType,
    @PositiveOrZero Integer videoBitrate,
    @PositiveOrZero Integer audioBitrate,
    Boolean forceEncode,
    AudioReplaceMode audioReplace,
    HotSwapMode hotSwap) {}

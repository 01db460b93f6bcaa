/*
 * Where: scheduler domain model
 * What: snapshot of a presets row
 * Why: both the license gate and the pipeline renderer read preset feature flags
 */
package com.zstrm.scheduler.model;

import java.time.Instant;

public record PresetRecord(
    Long presetId,
    String name,
    PresetType presetType,
    Integer videoBitrate,
    Integer audioBitrate,
    boolean forceEncode,
    AudioReplaceMode audioReplace,
    HotSwapMode hotSwap,
    Instant createdAt) {}

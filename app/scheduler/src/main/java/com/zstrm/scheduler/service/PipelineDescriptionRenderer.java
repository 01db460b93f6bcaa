package com.zstrm.scheduler.service;

import com.google.common.annotations.VisibleForTesting;
import com.zstrm.scheduler.model.AssetRecord;
import com.zstrm.scheduler.model.AudioReplaceMode;
import com.zstrm.scheduler.model.DestinationRecord;
import com.zstrm.scheduler.model.JobRecord;
import com.zstrm.scheduler.model.PresetRecord;
import com.zstrm.scheduler.model.PresetType;
import com.zstrm.scheduler.repository.AssetRepository;
import com.zstrm.scheduler.repository.DestinationRepository;
import com.zstrm.scheduler.repository.PresetRepository;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Renders the human-readable execution plan stored on a session.
 *
 * <p>Output shape: {@code ffmpeg <flags> // preset=<preset> // <audio|video-only> -> <endpoint>}.
 * Nothing is executed.
 */
@Component
@RequiredArgsConstructor
public class PipelineDescriptionRenderer {

  private static final String AUTO = "auto";

  private final AssetRepository assetRepository;
  private final PresetRepository presetRepository;
  private final DestinationRepository destinationRepository;

  public String render(JobRecord job) {
    final PresetRecord preset =
        job.presetId() == null ? null : presetRepository.findById(job.presetId()).orElse(null);
    final AssetRecord asset = assetRepository.findById(job.assetId()).orElse(null);
    final DestinationRecord destination =
        destinationRepository.findById(job.destinationId()).orElse(null);
    return describe(preset, asset, destination);
  }

  @VisibleForTesting
  static String describe(PresetRecord preset, AssetRecord asset, DestinationRecord destination) {
    final List<String> flags = new ArrayList<>();
    flags.add("-re");
    if (preset != null && preset.presetType() == PresetType.COPY && !preset.forceEncode()) {
      flags.add("-c copy");
    }
    if (preset != null && preset.audioReplace() == AudioReplaceMode.EXTERNAL_LOOP) {
      flags.add("-stream_loop -1 -i external_audio.mp3");
    }
    if (preset != null && preset.audioReplace() == AudioReplaceMode.VIDEO_ONLY) {
      flags.add("-an");
    }
    final String audioPart = asset != null && !asset.audioOnly() ? "audio" : "video-only";
    final String destinationPart = destination == null ? "unknown-dest" : destination.endpoint();
    return "ffmpeg "
        + String.join(" ", flags)
        + " // preset="
        + presetPart(preset)
        + " // "
        + audioPart
        + " -> "
        + destinationPart;
  }

  private static String presetPart(PresetRecord preset) {
    if (preset == null) {
      return "copy";
    }
    if (preset.presetType() == PresetType.ENCODE) {
      return "encode-v" + orAuto(preset.videoBitrate()) + "-a" + orAuto(preset.audioBitrate());
    }
    return preset.name();
  }

  private static String orAuto(Integer bitrate) {
    return bitrate == null || bitrate == 0 ? AUTO : bitrate.toString();
  }
}

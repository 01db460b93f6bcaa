/*
 * Where: scheduler service layer
 * What: registration and listing of assets, destinations and presets
 * Why: jobs can only reference catalog entries that exist
 */
package com.zstrm.scheduler.service;

import com.zstrm.scheduler.api.ResourceNotFoundException;
import com.zstrm.scheduler.api.request.CreateAssetRequest;
import com.zstrm.scheduler.api.request.CreateDestinationRequest;
import com.zstrm.scheduler.api.request.CreatePresetRequest;
import com.zstrm.scheduler.api.response.AssetResponse;
import com.zstrm.scheduler.api.response.DestinationResponse;
import com.zstrm.scheduler.api.response.PresetResponse;
import com.zstrm.scheduler.api.response.UploadResponse;
import com.zstrm.scheduler.model.AssetRecord;
import com.zstrm.scheduler.model.AudioReplaceMode;
import com.zstrm.scheduler.model.DestinationRecord;
import com.zstrm.scheduler.model.HotSwapMode;
import com.zstrm.scheduler.model.PresetRecord;
import com.zstrm.scheduler.model.PresetType;
import com.zstrm.scheduler.repository.AssetRepository;
import com.zstrm.scheduler.repository.DestinationRepository;
import com.zstrm.scheduler.repository.PresetRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CatalogService {

  static final long MAX_ASSET_BYTES = 500L * 1024 * 1024;

  private final AssetRepository assetRepository;
  private final DestinationRepository destinationRepository;
  private final PresetRepository presetRepository;
  private final Clock clock;

  public AssetResponse createAsset(@NonNull CreateAssetRequest request) {
    if (request.sizeBytes() != null && request.sizeBytes() > MAX_ASSET_BYTES) {
      throw new IllegalArgumentException("Assets limited to 500MB uploads");
    }
    final AssetRecord record =
        new AssetRecord(
            null,
            request.name(),
            request.sourceUrl(),
            request.sizeBytes(),
            request.durationSeconds(),
            request.thumbnailPath(),
            Boolean.TRUE.equals(request.audioOnly()),
            Instant.now(clock));
    final long assetId = assetRepository.insert(record);
    return AssetResponse.from(requireAsset(assetId));
  }

  public List<AssetResponse> listAssets(String query) {
    return assetRepository.findAll(query).stream().map(AssetResponse::from).toList();
  }

  /** Records the analysed duration and assigns a default thumbnail when none is set. */
  public UploadResponse finishUpload(long assetId, Integer analyzedDuration) {
    final AssetRecord asset = requireAsset(assetId);
    final String thumbnail =
        asset.thumbnailPath() == null ? "/thumbnails/" + assetId + ".jpg" : asset.thumbnailPath();
    assetRepository.updateMedia(assetId, analyzedDuration, thumbnail);
    return new UploadResponse(assetId, thumbnail, analyzedDuration);
  }

  public DestinationResponse createDestination(@NonNull CreateDestinationRequest request) {
    final DestinationRecord record =
        new DestinationRecord(
            null,
            request.name(),
            request.endpoint(),
            request.streamKey(),
            !Boolean.FALSE.equals(request.enabled()),
            Instant.now(clock));
    final long destinationId = destinationRepository.insert(record);
    return destinationRepository
        .findById(destinationId)
        .map(DestinationResponse::from)
        .orElseThrow(() -> new ResourceNotFoundException("destination", destinationId));
  }

  public List<DestinationResponse> listDestinations() {
    return destinationRepository.findAll().stream().map(DestinationResponse::from).toList();
  }

  public PresetResponse createPreset(@NonNull CreatePresetRequest request) {
    final PresetRecord record =
        new PresetRecord(
            null,
            request.name(),
            request.presetType() == null ? PresetType.COPY : request.presetType(),
            request.videoBitrate(),
            request.audioBitrate(),
            Boolean.TRUE.equals(request.forceEncode()),
            request.audioReplace() == null ? AudioReplaceMode.NONE : request.audioReplace(),
            request.hotSwap() == null ? HotSwapMode.NONE : request.hotSwap(),
            Instant.now(clock));
    final long presetId = presetRepository.insert(record);
    return presetRepository
        .findById(presetId)
        .map(PresetResponse::from)
        .orElseThrow(() -> new ResourceNotFoundException("preset", presetId));
  }

  public List<PresetResponse> listPresets() {
    return presetRepository.findAll().stream().map(PresetResponse::from).toList();
  }

  private AssetRecord requireAsset(long assetId) {
    return assetRepository
        .findById(assetId)
        .orElseThrow(() -> new ResourceNotFoundException("asset", assetId));
  }
}

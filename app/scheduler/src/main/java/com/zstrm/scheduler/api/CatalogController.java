/*
 * Where: scheduler API
 * What: asset, destination and preset endpoints
 * Why: catalog entries are created before jobs reference them
 */
package com.zstrm.scheduler.api;

import com.zstrm.scheduler.api.request.CreateAssetRequest;
import com.zstrm.scheduler.api.request.CreateDestinationRequest;
import com.zstrm.scheduler.api.request.CreatePresetRequest;
import com.zstrm.scheduler.api.response.AssetResponse;
import com.zstrm.scheduler.api.response.DestinationResponse;
import com.zstrm.scheduler.api.response.JobResponse;
import com.zstrm.scheduler.api.response.PresetResponse;
import com.zstrm.scheduler.api.response.UploadResponse;
import com.zstrm.scheduler.service.CatalogService;
import com.zstrm.scheduler.service.JobService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class CatalogController {

  private final CatalogService catalogService;
  private final JobService jobService;

  @PostMapping("/assets")
  public ResponseEntity<AssetResponse> createAsset(@Valid @RequestBody CreateAssetRequest request) {
    return ResponseEntity.ok(catalogService.createAsset(request));
  }

  @GetMapping("/assets")
  public ResponseEntity<List<AssetResponse>> listAssets(
      @RequestParam(name = "query", required = false) String query) {
    return ResponseEntity.ok(catalogService.listAssets(query));
  }

  @PostMapping("/assets/{assetId}/upload")
  public ResponseEntity<UploadResponse> finishUpload(
      @PathVariable("assetId") long assetId,
      @RequestParam(name = "analyzed_duration", required = false) Integer analyzedDuration) {
    return ResponseEntity.ok(catalogService.finishUpload(assetId, analyzedDuration));
  }

  @PostMapping("/destinations")
  public ResponseEntity<DestinationResponse> createDestination(
      @Valid @RequestBody CreateDestinationRequest request) {
    return ResponseEntity.ok(catalogService.createDestination(request));
  }

  @GetMapping("/destinations")
  public ResponseEntity<List<DestinationResponse>> listDestinations() {
    return ResponseEntity.ok(catalogService.listDestinations());
  }

  @PostMapping("/presets")
  public ResponseEntity<PresetResponse> createPreset(
      @Valid @RequestBody CreatePresetRequest request) {
    return ResponseEntity.ok(catalogService.createPreset(request));
  }

  @GetMapping("/presets")
  public ResponseEntity<List<PresetResponse>> listPresets() {
    return ResponseEntity.ok(catalogService.listPresets());
  }

  /** Returns the jobs that referenced the preset, re-evaluated. */
  @DeleteMapping("/presets/{presetId}")
  public ResponseEntity<List<JobResponse>> deletePreset(@PathVariable("presetId") long presetId) {
    return ResponseEntity.ok(jobService.deletePreset(presetId));
  }
}

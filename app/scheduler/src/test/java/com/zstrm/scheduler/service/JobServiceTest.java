package com.zstrm.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.zstrm.scheduler.api.ResourceNotFoundException;
import com.zstrm.scheduler.api.request.CreateJobRequest;
import com.zstrm.scheduler.api.response.JobResponse;
import com.zstrm.scheduler.model.AssetRecord;
import com.zstrm.scheduler.model.AudioReplaceMode;
import com.zstrm.scheduler.model.DestinationRecord;
import com.zstrm.scheduler.model.HotSwapMode;
import com.zstrm.scheduler.model.JobRecord;
import com.zstrm.scheduler.model.JobStatus;
import com.zstrm.scheduler.repository.AssetRepository;
import com.zstrm.scheduler.repository.DestinationRepository;
import com.zstrm.scheduler.repository.JobRepository;
import com.zstrm.scheduler.repository.PresetRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JobServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private JobRepository jobRepository;
  @Mock private AssetRepository assetRepository;
  @Mock private DestinationRepository destinationRepository;
  @Mock private PresetRepository presetRepository;
  @Mock private JobLicenseGate jobLicenseGate;

  private JobService service;

  @BeforeEach
  void setUp() {
    service =
        new JobService(
            jobRepository,
            assetRepository,
            destinationRepository,
            presetRepository,
            jobLicenseGate,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void createJobStoresPendingAndReturnsEvaluatedJob() {
    stubReferences();
    when(jobRepository.insert(any())).thenReturn(9L);
    final JobRecord stored = JobLicenseGateTest.job(9L, 3L, JobStatus.PENDING);
    when(jobRepository.findById(9L)).thenReturn(Optional.of(stored));
    when(jobLicenseGate.evaluate(stored))
        .thenReturn(
            new JobRecord(
                9L, 100L, 200L, 3L, JobStatus.INVALID, "Hot swap requires Premium", NOW, NOW, NOW));

    final JobResponse response = service.createJob(new CreateJobRequest(1L, 2L, 3L, null));

    final ArgumentCaptor<JobRecord> captor = ArgumentCaptor.forClass(JobRecord.class);
    verify(jobRepository).insert(captor.capture());
    assertThat(captor.getValue().status()).isEqualTo(JobStatus.PENDING);
    assertThat(captor.getValue().createdAt()).isEqualTo(NOW);
    assertThat(response.status()).isEqualTo("INVALID");
    assertThat(response.invalidReason()).isEqualTo("Hot swap requires Premium");
  }

  @Test
  void createJobRejectsUnknownDestination() {
    when(assetRepository.findById(1L)).thenReturn(Optional.of(asset()));
    when(destinationRepository.findById(2L)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.createJob(new CreateJobRequest(1L, 2L, 3L, null)))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessage("destination not found: 2");
    verify(jobRepository, never()).insert(any());
  }

  @Test
  void listJobsParsesStatusCaseInsensitively() {
    when(jobRepository.findByStatus(JobStatus.INVALID))
        .thenReturn(List.of(JobLicenseGateTest.job(4L, 1L, JobStatus.INVALID)));

    assertThat(service.listJobs(" invalid ")).extracting(JobResponse::jobId).containsExactly(4L);
  }

  @Test
  void listJobsRejectsUnknownStatus() {
    assertThatThrownBy(() -> service.listJobs("paused"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("unknown job status: paused");
  }

  @Test
  void deletePresetReevaluatesEveryJobThatUsedIt() {
    when(presetRepository.findById(3L))
        .thenReturn(Optional.of(JobLicenseGateTest.preset(3L, AudioReplaceMode.NONE, HotSwapMode.NONE)));
    when(jobRepository.findIdsByPresetId(3L)).thenReturn(List.of(5L, 6L));
    final JobRecord five = JobLicenseGateTest.job(5L, null, JobStatus.PENDING);
    when(jobRepository.findById(5L)).thenReturn(Optional.of(five));
    when(jobRepository.findById(6L)).thenReturn(Optional.empty());
    when(jobLicenseGate.evaluate(five))
        .thenReturn(new JobRecord(5L, 100L, 200L, null, JobStatus.INVALID, "Missing preset", NOW, NOW, NOW));

    final List<JobResponse> affected = service.deletePreset(3L);

    verify(presetRepository).deleteById(3L);
    assertThat(affected).extracting(JobResponse::invalidReason).containsExactly("Missing preset");
  }

  @Test
  void deletePresetRejectsUnknownPreset() {
    when(presetRepository.findById(3L)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.deletePreset(3L))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessage("preset not found: 3");
  }

  private void stubReferences() {
    when(assetRepository.findById(1L)).thenReturn(Optional.of(asset()));
    when(destinationRepository.findById(2L))
        .thenReturn(Optional.of(new DestinationRecord(2L, "live", "rtmp://live.test/app", null, true, NOW)));
    when(presetRepository.findById(3L))
        .thenReturn(Optional.of(JobLicenseGateTest.preset(3L, AudioReplaceMode.NONE, HotSwapMode.NONE)));
  }

  private static AssetRecord asset() {
    return new AssetRecord(1L, "clip", "s3://bucket/clip.mp4", 1024L, 60, "/thumbnails/1.jpg", false, NOW);
  }
}

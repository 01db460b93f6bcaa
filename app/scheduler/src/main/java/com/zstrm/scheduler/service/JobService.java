/*
 * Where: scheduler service layer
 * What: job creation, listing and on-demand license evaluation
 * Why: every new job passes the license gate before any schedule can start it
 */
package com.zstrm.scheduler.service;

import com.zstrm.scheduler.api.ResourceNotFoundException;
import com.zstrm.scheduler.api.request.CreateJobRequest;
import com.zstrm.scheduler.api.response.JobResponse;
import com.zstrm.scheduler.model.JobRecord;
import com.zstrm.scheduler.model.JobStatus;
import com.zstrm.scheduler.repository.AssetRepository;
import com.zstrm.scheduler.repository.DestinationRepository;
import com.zstrm.scheduler.repository.JobRepository;
import com.zstrm.scheduler.repository.PresetRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobService {

  private final JobRepository jobRepository;
  private final AssetRepository assetRepository;
  private final DestinationRepository destinationRepository;
  private final PresetRepository presetRepository;
  private final JobLicenseGate jobLicenseGate;
  private final Clock clock;

  /** Stores the job as PENDING and immediately evaluates it against the license. */
  public JobResponse createJob(@NonNull CreateJobRequest request) {
    if (assetRepository.findById(request.assetId()).isEmpty()) {
      throw new ResourceNotFoundException("asset", request.assetId());
    }
    if (destinationRepository.findById(request.destinationId()).isEmpty()) {
      throw new ResourceNotFoundException("destination", request.destinationId());
    }
    if (presetRepository.findById(request.presetId()).isEmpty()) {
      throw new ResourceNotFoundException("preset", request.presetId());
    }
    final Instant now = Instant.now(clock);
    final JobRecord pending =
        new JobRecord(
            null,
            request.assetId(),
            request.destinationId(),
            request.presetId(),
            JobStatus.PENDING,
            null,
            now,
            now,
            request.requestedAt());
    final long jobId = jobRepository.insert(pending);
    return JobResponse.from(jobLicenseGate.evaluate(requireJob(jobId)));
  }

  public List<JobResponse> listJobs(String status) {
    final List<JobRecord> jobs =
        status == null || status.isBlank()
            ? jobRepository.findAll()
            : jobRepository.findByStatus(parseStatus(status));
    return jobs.stream().map(JobResponse::from).toList();
  }

  public JobResponse evaluateJob(long jobId) {
    return JobResponse.from(jobLicenseGate.evaluate(requireJob(jobId)));
  }

  /** Removes a preset; jobs that used it are re-evaluated and end up INVALID. */
  public List<JobResponse> deletePreset(long presetId) {
    if (presetRepository.findById(presetId).isEmpty()) {
      throw new ResourceNotFoundException("preset", presetId);
    }
    final List<Long> affected = jobRepository.findIdsByPresetId(presetId);
    presetRepository.deleteById(presetId);
    return affected.stream()
        .map(jobRepository::findById)
        .flatMap(Optional::stream)
        .map(jobLicenseGate::evaluate)
        .map(JobResponse::from)
        .toList();
  }

  private JobRecord requireJob(long jobId) {
    return jobRepository
        .findById(jobId)
        .orElseThrow(() -> new ResourceNotFoundException("job", jobId));
  }

  private static JobStatus parseStatus(String status) {
    try {
      return JobStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown job status: " + status, ex);
    }
  }
}

/*
 * Where: scheduler service layer
 * What: checks a job's preset features against the effective license tier
 * Why: jobs needing features the tier lacks must never start
 */
package com.zstrm.scheduler.service;

import com.google.common.annotations.VisibleForTesting;
import com.zstrm.scheduler.model.AudioReplaceMode;
import com.zstrm.scheduler.model.EventLogRecord;
import com.zstrm.scheduler.model.EventType;
import com.zstrm.scheduler.model.HotSwapMode;
import com.zstrm.scheduler.model.JobRecord;
import com.zstrm.scheduler.model.JobStatus;
import com.zstrm.scheduler.model.LicenseTier;
import com.zstrm.scheduler.model.PresetRecord;
import com.zstrm.scheduler.repository.EventLogRepository;
import com.zstrm.scheduler.repository.JobRepository;
import com.zstrm.scheduler.repository.PresetRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class JobLicenseGate implements JobReevaluator {

  public static final String REASON_MISSING_PRESET = "Missing preset";
  public static final String REASON_AUDIO_REPLACE = "Audio replace requires Premium";
  public static final String REASON_HOT_SWAP = "Hot swap requires Premium";
  public static final String REASON_IMMEDIATE_SWAP = "Immediate swaps require Ultimate";

  private static final Logger logger = LoggerFactory.getLogger(JobLicenseGate.class);

  private final JobRepository jobRepository;
  private final PresetRepository presetRepository;
  private final EventLogRepository eventLogRepository;
  private final LicenseStateStore licenseStateStore;
  private final Clock clock;

  /** Invalidates the job or resets it to PENDING with no reason. */
  @Transactional
  public JobRecord evaluate(JobRecord job) {
    final Optional<String> reason = check(job, licenseStateStore.currentTier());
    if (reason.isPresent()) {
      return invalidate(job, reason.get());
    }
    return markPending(job);
  }

  /** Re-reads the job's preset; empty when {@code tier} allows every feature it uses. */
  public Optional<String> check(JobRecord job, LicenseTier tier) {
    final Optional<PresetRecord> preset =
        job.presetId() == null ? Optional.empty() : presetRepository.findById(job.presetId());
    if (preset.isEmpty()) {
      return Optional.of(REASON_MISSING_PRESET);
    }
    return Optional.ofNullable(rejectionReason(preset.get(), tier));
  }

  /** A job already INVALID for the same reason is returned untouched and not audited again. */
  @Transactional
  public JobRecord invalidate(JobRecord job, String reason) {
    if (job.status() == JobStatus.INVALID && reason.equals(job.invalidReason())) {
      return job;
    }
    final Instant now = Instant.now(clock);
    jobRepository.updateStatus(job.jobId(), JobStatus.INVALID, reason, now);
    eventLogRepository.append(
        EventLogRecord.of(null, job.jobId(), null, EventType.INVALIDATED, reason), now);
    logger.info("job invalidated jobId={} reason={}", job.jobId(), reason);
    return withStatus(job, JobStatus.INVALID, reason, now);
  }

  /**
   * Applies the gate to every job after a tier change. CANCELLED jobs are skipped, and a job
   * the tier still allows keeps its status unless it was INVALID.
   */
  @Override
  @Transactional
  public void reevaluateAll() {
    final LicenseTier tier = licenseStateStore.currentTier();
    final List<JobRecord> jobs = jobRepository.findAll();
    int invalid = 0;
    int restored = 0;
    for (JobRecord job : jobs) {
      if (job.status() == JobStatus.CANCELLED) {
        continue;
      }
      final Optional<String> reason = check(job, tier);
      if (reason.isPresent()) {
        invalidate(job, reason.get());
        invalid++;
      } else if (job.status() == JobStatus.INVALID) {
        markPending(job);
        restored++;
      }
    }
    logger.info(
        "jobs re-evaluated tier={} total={} invalid={} restored={}",
        tier.value(),
        jobs.size(),
        invalid,
        restored);
  }

  private JobRecord markPending(JobRecord job) {
    final Instant now = Instant.now(clock);
    jobRepository.updateStatus(job.jobId(), JobStatus.PENDING, null, now);
    return withStatus(job, JobStatus.PENDING, null, now);
  }

  /** Null when the tier allows every feature the preset uses. */
  @VisibleForTesting
  static String rejectionReason(PresetRecord preset, LicenseTier tier) {
    if (tier == LicenseTier.BASIC) {
      if (preset.audioReplace() != AudioReplaceMode.NONE) {
        return REASON_AUDIO_REPLACE;
      }
      if (preset.hotSwap() != HotSwapMode.NONE) {
        return REASON_HOT_SWAP;
      }
    }
    if (tier != LicenseTier.ULTIMATE && preset.hotSwap() == HotSwapMode.IMMEDIATE) {
      return REASON_IMMEDIATE_SWAP;
    }
    return null;
  }

  private static JobRecord withStatus(
      JobRecord job, JobStatus status, String invalidReason, Instant updatedAt) {
    return new JobRecord(
        job.jobId(),
        job.assetId(),
        job.destinationId(),
        job.presetId(),
        status,
        invalidReason,
        job.createdAt(),
        updatedAt,
        job.requestedAt());
  }
}

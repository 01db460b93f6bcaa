/*
 * Where: scheduler service layer
 * What: runs one schedule through evaluation, gating and the session lifecycle
 * Why: the tick loop and the run-now endpoint must take the same path
 */
package com.zstrm.scheduler.service;

import com.zstrm.scheduler.model.ExecutionOutcome;
import com.zstrm.scheduler.model.JobRecord;
import com.zstrm.scheduler.model.JobStatus;
import com.zstrm.scheduler.model.LicenseTier;
import com.zstrm.scheduler.model.ScheduleDecision;
import com.zstrm.scheduler.model.ScheduleRecord;
import com.zstrm.scheduler.model.SessionRecord;
import com.zstrm.scheduler.repository.JobRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ScheduleProcessor {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleProcessor.class);

  private final JobRepository jobRepository;
  private final ScheduleEvaluator evaluator;
  private final JobLicenseGate jobLicenseGate;
  private final LicenseService licenseService;
  private final SessionLifecycleService sessionLifecycle;
  private final PipelineExecutor pipelineExecutor;
  private final Clock clock;

  /**
   * Evaluates the schedule now and, when it is due and valid, runs one session to completion.
   *
   * @return the started session as it was opened, or empty when nothing was started
   */
  public Optional<SessionRecord> process(ScheduleRecord schedule) {
    final Optional<JobRecord> found = jobRepository.findById(schedule.jobId());
    if (found.isEmpty()) {
      logger.warn(
          "schedule references missing job scheduleId={} jobId={}",
          schedule.scheduleId(),
          schedule.jobId());
      return Optional.empty();
    }
    final JobRecord job = found.get();
    if (job.status() == JobStatus.CANCELLED) {
      return Optional.empty();
    }
    final LicenseTier tier = licenseService.currentTier();
    final ScheduleDecision decision = evaluator.evaluate(schedule, tier, Instant.now(clock));
    switch (decision.outcome()) {
      case SKIP:
        return Optional.empty();
      case INVALID:
        jobLicenseGate.invalidate(job, decision.reason());
        return Optional.empty();
      case RUN:
      default:
        break;
    }
    final Optional<String> gateReason = jobLicenseGate.check(job, tier);
    if (gateReason.isPresent()) {
      jobLicenseGate.invalidate(job, gateReason.get());
      return Optional.empty();
    }
    final SessionRecord session = sessionLifecycle.start(schedule, job);
    final ExecutionOutcome outcome = pipelineExecutor.execute(session);
    sessionLifecycle.complete(session.sessionId(), outcome);
    return Optional.of(session);
  }
}

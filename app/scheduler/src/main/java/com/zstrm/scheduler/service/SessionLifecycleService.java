/*
 * Where: scheduler service layer
 * What: opens and closes sessions together with the job, schedule and event side effects
 * Why: a session start or stop is only observable through these rows
 */
package com.zstrm.scheduler.service;

import com.zstrm.scheduler.model.EventLogRecord;
import com.zstrm.scheduler.model.EventType;
import com.zstrm.scheduler.model.ExecutionOutcome;
import com.zstrm.scheduler.model.JobRecord;
import com.zstrm.scheduler.model.JobStatus;
import com.zstrm.scheduler.model.ScheduleRecord;
import com.zstrm.scheduler.model.SessionRecord;
import com.zstrm.scheduler.repository.EventLogRepository;
import com.zstrm.scheduler.repository.JobRepository;
import com.zstrm.scheduler.repository.ScheduleRepository;
import com.zstrm.scheduler.repository.SessionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class SessionLifecycleService {

  private static final Logger logger = LoggerFactory.getLogger(SessionLifecycleService.class);

  private final SessionRepository sessionRepository;
  private final JobRepository jobRepository;
  private final ScheduleRepository scheduleRepository;
  private final EventLogRepository eventLogRepository;
  private final PipelineDescriptionRenderer pipelineRenderer;
  private final SchedulerMetrics metrics;
  private final Clock clock;

  @Transactional
  public SessionRecord start(ScheduleRecord schedule, JobRecord job) {
    final Instant now = Instant.now(clock);
    final String pipeline = pipelineRenderer.render(job);
    final SessionRecord running =
        new SessionRecord(
            null, schedule.scheduleId(), job.jobId(), now, null, JobStatus.RUNNING, pipeline, null);
    final long sessionId = sessionRepository.insert(running);
    jobRepository.updateStatus(job.jobId(), JobStatus.RUNNING, null, now);
    scheduleRepository.markRun(schedule.scheduleId(), now);
    eventLogRepository.append(
        EventLogRecord.of(
            sessionId,
            job.jobId(),
            schedule.scheduleId(),
            EventType.STARTED,
            "Session started with pipeline " + pipeline),
        now);
    metrics.recordSessionStarted();
    logger.info(
        "session started sessionId={} scheduleId={} jobId={}",
        sessionId,
        schedule.scheduleId(),
        job.jobId());
    return new SessionRecord(
        sessionId,
        running.scheduleId(),
        running.jobId(),
        running.startedAt(),
        null,
        JobStatus.RUNNING,
        pipeline,
        null);
  }

  /**
   * Closes a running session with the executor's outcome.
   *
   * @return false when the session is gone or was already ended
   */
  @Transactional
  public boolean complete(long sessionId, ExecutionOutcome outcome) {
    final Optional<SessionRecord> found = sessionRepository.findById(sessionId);
    if (found.isEmpty()) {
      logger.warn("session vanished before completion sessionId={}", sessionId);
      return false;
    }
    final SessionRecord session = found.get();
    if (session.isEnded()) {
      return false;
    }
    final Instant now = Instant.now(clock);
    final JobStatus status = outcome.success() ? JobStatus.COMPLETED : JobStatus.FAILED;
    if (sessionRepository.complete(sessionId, status, now, outcome.reason()) == 0) {
      return false;
    }
    jobRepository.updateStatusIf(session.jobId(), JobStatus.RUNNING, status, now);
    final String message =
        outcome.success() ? "Session completed" : "Session failed: " + outcome.reason();
    eventLogRepository.append(
        EventLogRecord.of(
            sessionId, session.jobId(), session.scheduleId(), EventType.STOPPED, message),
        now);
    logger.info("session ended sessionId={} status={}", sessionId, status);
    return true;
  }
}

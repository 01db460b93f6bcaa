/*
 * Where: scheduler service layer
 * What: schedule creation, listing and the run-now entry point
 * Why: operators start a job immediately through the same path the tick loop uses
 */
package com.zstrm.scheduler.service;

import com.zstrm.scheduler.api.ResourceNotFoundException;
import com.zstrm.scheduler.api.RunNowConflictException;
import com.zstrm.scheduler.api.request.CreateScheduleRequest;
import com.zstrm.scheduler.api.request.RunNowRequest;
import com.zstrm.scheduler.api.response.ScheduleResponse;
import com.zstrm.scheduler.api.response.SessionResponse;
import com.zstrm.scheduler.model.JobRecord;
import com.zstrm.scheduler.model.ScheduleMode;
import com.zstrm.scheduler.model.ScheduleRecord;
import com.zstrm.scheduler.model.SessionRecord;
import com.zstrm.scheduler.repository.JobRepository;
import com.zstrm.scheduler.repository.ScheduleRepository;
import com.zstrm.scheduler.repository.SessionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ScheduleService {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);

  private final ScheduleRepository scheduleRepository;
  private final JobRepository jobRepository;
  private final SessionRepository sessionRepository;
  private final ScheduleProcessor scheduleProcessor;
  private final Clock clock;

  public ScheduleResponse createSchedule(@NonNull CreateScheduleRequest request) {
    requireJob(request.jobId());
    if (request.endsAt() != null && request.endsAt().isBefore(request.startsAt())) {
      throw new IllegalArgumentException("ends_at must not be before starts_at");
    }
    final boolean runNow = Boolean.TRUE.equals(request.runNow());
    final ScheduleRecord draft =
        new ScheduleRecord(
            null,
            request.jobId(),
            request.startsAt(),
            request.endsAt(),
            request.durationMinutes(),
            request.mode() == null ? ScheduleMode.ONE_TIME : request.mode(),
            Boolean.TRUE.equals(request.loop()),
            runNow,
            Instant.now(clock),
            null);
    final long scheduleId = scheduleRepository.insert(draft);
    ScheduleRecord stored = requireSchedule(scheduleId);
    if (runNow) {
      scheduleProcessor.process(stored);
      stored = requireSchedule(scheduleId);
    }
    return ScheduleResponse.from(stored);
  }

  public List<ScheduleResponse> listSchedules() {
    return scheduleRepository.findAll().stream().map(ScheduleResponse::from).toList();
  }

  /**
   * Processes a schedule of the job right away.
   *
   * @throws RunNowConflictException when no session was started, e.g. the job is invalid
   */
  public SessionResponse runNow(@NonNull RunNowRequest request) {
    final JobRecord job = requireJob(request.jobId());
    final ScheduleRecord schedule =
        request.scheduleId() == null ? createAdHocSchedule(job) : requireSchedule(request.scheduleId());
    if (!schedule.jobId().equals(job.jobId())) {
      throw new IllegalArgumentException(
          "schedule " + schedule.scheduleId() + " does not belong to job " + job.jobId());
    }
    final Optional<SessionRecord> started = scheduleProcessor.process(schedule);
    if (started.isEmpty()) {
      final String reason =
          jobRepository.findById(job.jobId()).map(JobRecord::invalidReason).orElse(null);
      throw new RunNowConflictException(
          reason == null
              ? "no session started for job " + job.jobId()
              : "job " + job.jobId() + " is invalid: " + reason);
    }
    final long sessionId = started.get().sessionId();
    return sessionRepository
        .findById(sessionId)
        .map(SessionResponse::from)
        .orElseThrow(() -> new ResourceNotFoundException("session", sessionId));
  }

  private ScheduleRecord createAdHocSchedule(JobRecord job) {
    final Instant now = Instant.now(clock);
    final ScheduleRecord adHoc =
        new ScheduleRecord(
            null, job.jobId(), now, null, null, ScheduleMode.ONE_TIME, false, true, now, null);
    final long scheduleId = scheduleRepository.insert(adHoc);
    logger.info("ad-hoc schedule created scheduleId={} jobId={}", scheduleId, job.jobId());
    return requireSchedule(scheduleId);
  }

  private JobRecord requireJob(long jobId) {
    return jobRepository
        .findById(jobId)
        .orElseThrow(() -> new ResourceNotFoundException("job", jobId));
  }

  private ScheduleRecord requireSchedule(long scheduleId) {
    return scheduleRepository
        .findById(scheduleId)
        .orElseThrow(() -> new ResourceNotFoundException("schedule", scheduleId));
  }
}

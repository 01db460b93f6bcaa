/*
 * Where: scheduler service layer
 * What: one scheduler tick: take the lease, process every schedule, queue bounded retries
 * Why: a single runner drives schedules and one failing schedule must not stall the rest
 */
package com.zstrm.scheduler.service;

import com.google.common.annotations.VisibleForTesting;
import com.zstrm.common.TraceIds;
import com.zstrm.scheduler.config.SchedulerProperties;
import com.zstrm.scheduler.model.EventLogRecord;
import com.zstrm.scheduler.model.EventType;
import com.zstrm.scheduler.model.ScheduleRecord;
import com.zstrm.scheduler.repository.EventLogRepository;
import com.zstrm.scheduler.repository.ScheduleRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SchedulerLoopService {

  private static final Logger logger = LoggerFactory.getLogger(SchedulerLoopService.class);
  private static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

  private final LeaseLockService leaseLockService;
  private final RunnerIdentity runnerIdentity;
  private final ScheduleRepository scheduleRepository;
  private final EventLogRepository eventLogRepository;
  private final ScheduleProcessor scheduleProcessor;
  private final ScheduleEvaluator evaluator;
  private final SchedulerProperties properties;
  private final TaskScheduler taskScheduler;
  private final SchedulerMetrics metrics;
  private final Clock clock;

  /**
   * Runs one tick; never throws.
   *
   * @return number of schedules processed, or -1 when another runner holds the lease
   */
  public int tick() {
    final String traceId = TraceIds.newTraceId();
    MDC.put(TraceIds.MDC_KEY, traceId);
    try {
      if (!holdsLease()) {
        metrics.recordTick("lock_held");
        return -1;
      }
      final List<ScheduleRecord> schedules = scheduleRepository.findAll();
      int retriesQueued = 0;
      for (ScheduleRecord schedule : schedules) {
        try {
          scheduleProcessor.process(schedule);
        } catch (RuntimeException ex) {
          if (handleFailure(schedule, ex, retriesQueued < properties.maxRetriesPerTick(), traceId)) {
            retriesQueued++;
          }
        }
      }
      metrics.recordTick("processed");
      logger.debug("scheduler tick done schedules={} retriesQueued={}", schedules.size(), retriesQueued);
      return schedules.size();
    } catch (RuntimeException ex) {
      logger.error("scheduler tick failed", ex);
      metrics.recordTick("failed");
      return 0;
    } finally {
      MDC.remove(TraceIds.MDC_KEY);
    }
  }

  private boolean holdsLease() {
    return leaseLockService.acquire(
        properties.lockName(), runnerIdentity.runnerId(), properties.lockTtl());
  }

  /** Records the failure and queues a single retry one tick later when allowed. */
  @VisibleForTesting
  boolean handleFailure(
      ScheduleRecord schedule, RuntimeException ex, boolean retryAllowed, String traceId) {
    metrics.recordScheduleError();
    logger.warn(
        "schedule processing failed scheduleId={} jobId={}",
        schedule.scheduleId(),
        schedule.jobId(),
        ex);
    recordRetryEvent(schedule, ex);
    final Instant now = Instant.now(clock);
    if (!evaluator.withinRetryWindow(schedule, now)) {
      logger.info("schedule outside retry window scheduleId={}", schedule.scheduleId());
      return false;
    }
    if (!retryAllowed) {
      logger.warn(
          "retry cap reached, schedule left for next tick scheduleId={} cap={}",
          schedule.scheduleId(),
          properties.maxRetriesPerTick());
      return false;
    }
    final long scheduleId = schedule.scheduleId();
    taskScheduler.schedule(
        () -> retry(scheduleId, traceId), now.plus(properties.tickInterval()));
    return true;
  }

  /** Second and last attempt for a schedule that failed during a tick. */
  @VisibleForTesting
  void retry(long scheduleId, String traceId) {
    MDC.put(TraceIds.MDC_KEY, traceId);
    try {
      if (!holdsLease()) {
        logger.info("retry dropped, lease lost scheduleId={}", scheduleId);
        return;
      }
      final ScheduleRecord schedule = scheduleRepository.findById(scheduleId).orElse(null);
      if (schedule == null) {
        logger.info("retry dropped, schedule deleted scheduleId={}", scheduleId);
        return;
      }
      try {
        scheduleProcessor.process(schedule);
      } catch (RuntimeException ex) {
        metrics.recordScheduleError();
        logger.warn("schedule retry failed scheduleId={}", scheduleId, ex);
        recordRetryEvent(schedule, ex);
      }
    } catch (RuntimeException ex) {
      logger.error("schedule retry aborted scheduleId={}", scheduleId, ex);
    } finally {
      MDC.remove(TraceIds.MDC_KEY);
    }
  }

  private void recordRetryEvent(ScheduleRecord schedule, RuntimeException ex) {
    try {
      eventLogRepository.append(
          EventLogRecord.of(
              null, schedule.jobId(), schedule.scheduleId(), EventType.RETRY, describe(ex)),
          Instant.now(clock));
    } catch (RuntimeException appendEx) {
      // keep going with the remaining schedules of this tick
      logger.error("retry event not recorded scheduleId={}", schedule.scheduleId(), appendEx);
    }
  }

  private static String describe(RuntimeException ex) {
    final String message = ex.getMessage() == null ? ex.toString() : ex.getMessage();
    return message.length() <= MAX_ERROR_MESSAGE_LENGTH
        ? message
        : message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
  }
}

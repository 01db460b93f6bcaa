/*
 * Where: scheduler service layer
 * What: tick, session, schedule error and license renewal meters
 * Why: operators watch the control loop from Prometheus without reading the event log
 */
package com.zstrm.scheduler.service;

import com.zstrm.scheduler.model.LicenseTier;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class SchedulerMetrics {

  static final String METRIC_TICK_TOTAL = "scheduler.tick.total";
  static final String METRIC_SESSION_STARTED_TOTAL = "scheduler.session.started.total";
  static final String METRIC_SCHEDULE_ERROR_TOTAL = "scheduler.schedule.error.total";
  static final String METRIC_RENEWAL_TOTAL = "licensing.renewal.total";
  static final String METRIC_EFFECTIVE_TIER = "licensing.effective.tier";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger effectiveTier = new AtomicInteger(LicenseTier.BASIC.ordinal());
  private final ConcurrentMap<String, Counter> tickCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> renewalCounters = new ConcurrentHashMap<>();
  private final Counter sessionStartedCounter;
  private final Counter scheduleErrorCounter;

  public SchedulerMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_EFFECTIVE_TIER, effectiveTier, AtomicInteger::get)
        .description("Effective license tier (0=basic, 1=premium, 2=ultimate)")
        .register(meterRegistry);
    this.sessionStartedCounter =
        Counter.builder(METRIC_SESSION_STARTED_TOTAL)
            .description("Sessions started by the scheduler")
            .register(meterRegistry);
    this.scheduleErrorCounter =
        Counter.builder(METRIC_SCHEDULE_ERROR_TOTAL)
            .description("Unhandled errors while processing a schedule")
            .register(meterRegistry);
  }

  /** result: processed, lock_held, failed */
  public void recordTick(String result) {
    tickCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_TICK_TOTAL)
                    .description("Scheduler tick outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordSessionStarted() {
    sessionStartedCounter.increment();
  }

  public void recordScheduleError() {
    scheduleErrorCounter.increment();
  }

  /** result: success, failure, downgraded */
  public void recordRenewal(String result) {
    renewalCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_RENEWAL_TOTAL)
                    .description("License renewal outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void updateEffectiveTier(LicenseTier tier) {
    effectiveTier.set(tier.ordinal());
  }
}

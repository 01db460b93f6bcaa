/*
 * Where: scheduler configuration binding
 * What: tick interval, lease lock name, runner identity and retry cap of the scheduler loop
 * Why: operators tune the loop per environment without code changes
 */
package com.zstrm.scheduler.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "scheduler")
public record SchedulerProperties(
    boolean enabled,
    @NotNull Duration tickInterval,
    @NotBlank String lockName,
    String runnerId,
    @PositiveOrZero int maxRetriesPerTick) {

  private static final int LOCK_TTL_TICKS = 3;

  /** Lease TTL covers three ticks so one slow tick does not hand the lock to another runner. */
  public Duration lockTtl() {
    return tickInterval.multipliedBy(LOCK_TTL_TICKS);
  }
}

/*
 * Where: scheduler worker
 * What: fires the scheduler tick at a fixed delay and hands the lease back on shutdown
 * Why: the lease lets another runner take over without waiting out the TTL
 */
package com.zstrm.scheduler.worker;

import com.zstrm.scheduler.config.SchedulerProperties;
import com.zstrm.scheduler.service.LeaseLockService;
import com.zstrm.scheduler.service.RunnerIdentity;
import com.zstrm.scheduler.service.SchedulerLoopService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerWorker {

  private static final Logger logger = LoggerFactory.getLogger(SchedulerWorker.class);

  private final SchedulerLoopService loopService;
  private final LeaseLockService leaseLockService;
  private final RunnerIdentity runnerIdentity;
  private final SchedulerProperties properties;

  @Scheduled(fixedDelayString = "${scheduler.tick-interval}")
  public void run() {
    loopService.tick();
  }

  @PreDestroy
  public void releaseLease() {
    try {
      leaseLockService.release(properties.lockName(), runnerIdentity.runnerId());
    } catch (RuntimeException ex) {
      logger.warn("lease release on shutdown failed lockName={}", properties.lockName(), ex);
    }
  }
}

/*
 * Where: scheduler worker
 * What: drives license renewal cycles with a delay chosen by each cycle's outcome
 * Why: success waits a full lease while failure retries after a short backoff
 */
package com.zstrm.scheduler.worker;

import com.google.common.annotations.VisibleForTesting;
import com.zstrm.scheduler.config.LicensingProperties;
import com.zstrm.scheduler.service.LicenseRenewalService;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "licensing.enabled", havingValue = "true", matchIfMissing = true)
public class LicenseRenewalWorker {

  private static final Logger logger = LoggerFactory.getLogger(LicenseRenewalWorker.class);

  private final LicenseRenewalService renewalService;
  private final LicensingProperties properties;
  private final TaskScheduler taskScheduler;

  private volatile Duration nextDelay = Duration.ZERO;
  private volatile ScheduledFuture<?> future;

  @EventListener(ApplicationReadyEvent.class)
  public synchronized void start() {
    if (future != null) {
      return;
    }
    future = taskScheduler.schedule(this::runCycle, new RenewalTrigger());
    logger.info("license renewal started endpoint={}{}", properties.baseUrl(), properties.renewPath());
  }

  @PreDestroy
  public synchronized void stop() {
    if (future != null) {
      future.cancel(false);
      future = null;
      logger.info("license renewal stopped");
    }
  }

  @VisibleForTesting
  void runCycle() {
    try {
      nextDelay = renewalService.renewCycle();
    } catch (RuntimeException ex) {
      logger.error("license renewal cycle failed", ex);
      nextDelay = properties.retryBackoff();
    }
  }

  @VisibleForTesting
  Duration nextDelay() {
    return nextDelay;
  }

  private final class RenewalTrigger implements Trigger {

    @Override
    public Instant nextExecution(TriggerContext triggerContext) {
      final Instant lastCompletion = triggerContext.lastCompletion();
      if (lastCompletion == null) {
        return triggerContext.getClock().instant();
      }
      return lastCompletion.plus(nextDelay);
    }
  }
}

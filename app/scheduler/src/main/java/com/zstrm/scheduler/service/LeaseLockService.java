package com.zstrm.scheduler.service;

import com.zstrm.scheduler.repository.LeaseLockRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Advisory, time-leased mutual exclusion between runner processes.
 *
 * <p>A holder keeps the lock by re-acquiring it before {@code ttl} elapses; a crashed holder
 * loses it once the lease expires.
 */
@Service
@RequiredArgsConstructor
public class LeaseLockService {

  private static final Logger logger = LoggerFactory.getLogger(LeaseLockService.class);

  private final LeaseLockRepository leaseLockRepository;
  private final Clock clock;

  public boolean acquire(String lockName, String runnerId, Duration ttl) {
    final Instant now = Instant.now(clock);
    final boolean acquired =
        leaseLockRepository.tryAcquire(lockName, runnerId, now, now.plus(ttl));
    if (!acquired) {
      logger.debug("lease lock held elsewhere lockName={} runnerId={}", lockName, runnerId);
    }
    return acquired;
  }

  /** Hands the lock over early on shutdown; a no-op when another runner already owns it. */
  public void release(String lockName, String runnerId) {
    final int released = leaseLockRepository.release(lockName, runnerId, Instant.now(clock));
    if (released > 0) {
      logger.info("lease lock released lockName={} runnerId={}", lockName, runnerId);
    }
  }
}

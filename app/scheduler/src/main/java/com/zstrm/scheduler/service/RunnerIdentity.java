/*
 * Where: scheduler service layer
 * What: the identity this process writes into lease lock rows
 * Why: lock ownership must be stable for the lifetime of a runner process
 */
package com.zstrm.scheduler.service;

import com.google.common.annotations.VisibleForTesting;
import com.zstrm.scheduler.config.SchedulerProperties;
import java.net.InetAddress;
import java.net.UnknownHostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RunnerIdentity {

  private static final Logger logger = LoggerFactory.getLogger(RunnerIdentity.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final String runnerId;

  public RunnerIdentity(SchedulerProperties properties) {
    this.runnerId = resolve(properties.runnerId(), System.getenv(HOSTNAME_ENV));
    logger.info("runner identity resolved runnerId={}", runnerId);
  }

  public String runnerId() {
    return runnerId;
  }

  @VisibleForTesting
  static String resolve(String configured, String hostnameEnv) {
    if (configured != null && !configured.isBlank()) {
      return configured.trim();
    }
    if (hostnameEnv != null && !hostnameEnv.isBlank()) {
      return hostnameEnv;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}

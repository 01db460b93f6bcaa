package com.zstrm.scheduler.service;

import com.zstrm.scheduler.api.response.DashboardResponse;
import com.zstrm.scheduler.api.response.EventResponse;
import com.zstrm.scheduler.api.response.LicenseResponse;
import com.zstrm.scheduler.api.response.SessionResponse;
import com.zstrm.scheduler.model.JobStatus;
import com.zstrm.scheduler.model.LicenseStateRecord;
import com.zstrm.scheduler.repository.AssetRepository;
import com.zstrm.scheduler.repository.DestinationRepository;
import com.zstrm.scheduler.repository.EventLogRepository;
import com.zstrm.scheduler.repository.JobRepository;
import com.zstrm.scheduler.repository.PresetRepository;
import com.zstrm.scheduler.repository.SessionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Read-only views over sessions, events, counts and license state. */
@Service
@RequiredArgsConstructor
public class MonitoringService {

  static final int MAX_LIMIT = 500;

  private final SessionRepository sessionRepository;
  private final EventLogRepository eventLogRepository;
  private final AssetRepository assetRepository;
  private final DestinationRepository destinationRepository;
  private final PresetRepository presetRepository;
  private final JobRepository jobRepository;
  private final LicenseService licenseService;
  private final Clock clock;

  public List<SessionResponse> recentSessions(int limit) {
    return sessionRepository.findRecent(clamp(limit)).stream().map(SessionResponse::from).toList();
  }

  public List<EventResponse> recentEvents(int limit) {
    return eventLogRepository.findRecent(clamp(limit)).stream().map(EventResponse::from).toList();
  }

  public DashboardResponse dashboard() {
    return new DashboardResponse(
        sessionRepository.countAll(),
        assetRepository.countAll(),
        destinationRepository.countAll(),
        presetRepository.countAll(),
        sessionRepository.countActive(),
        jobRepository.countByStatus(JobStatus.INVALID));
  }

  public LicenseResponse license() {
    final Instant now = Instant.now(clock);
    final LicenseStateRecord state = licenseService.currentState();
    return new LicenseResponse(
        state.tier().value(),
        state.effectiveTier(now).value(),
        state.statusAt(now).name(),
        state.installId(),
        state.leaseExpiresAt(),
        state.graceExpiresAt(),
        state.lastCheckedAt());
  }

  private static int clamp(int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive");
    }
    return Math.min(limit, MAX_LIMIT);
  }
}

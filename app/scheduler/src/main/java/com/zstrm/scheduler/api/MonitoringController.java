package com.zstrm.scheduler.api;

import com.zstrm.scheduler.api.response.DashboardResponse;
import com.zstrm.scheduler.api.response.EventResponse;
import com.zstrm.scheduler.api.response.LicenseResponse;
import com.zstrm.scheduler.api.response.SessionResponse;
import com.zstrm.scheduler.service.MonitoringService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Observable state: sessions, the event log, dashboard counts and the license. */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class MonitoringController {

  private final MonitoringService monitoringService;

  @GetMapping("/sessions")
  public ResponseEntity<List<SessionResponse>> sessions(
      @RequestParam(name = "limit", defaultValue = "100") int limit) {
    return ResponseEntity.ok(monitoringService.recentSessions(limit));
  }

  @GetMapping("/events")
  public ResponseEntity<List<EventResponse>> events(
      @RequestParam(name = "limit", defaultValue = "100") int limit) {
    return ResponseEntity.ok(monitoringService.recentEvents(limit));
  }

  @GetMapping("/dashboard")
  public ResponseEntity<DashboardResponse> dashboard() {
    return ResponseEntity.ok(monitoringService.dashboard());
  }

  @GetMapping("/license")
  public ResponseEntity<LicenseResponse> license() {
    return ResponseEntity.ok(monitoringService.license());
  }
}

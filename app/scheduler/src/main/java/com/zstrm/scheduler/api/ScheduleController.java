/*
 * Where: scheduler API
 * What: schedule endpoints and the run-now trigger
 * Why: run-now and run_now schedules go through the same processing as a tick
 */
package com.zstrm.scheduler.api;

import com.zstrm.scheduler.api.request.CreateScheduleRequest;
import com.zstrm.scheduler.api.request.RunNowRequest;
import com.zstrm.scheduler.api.response.ScheduleResponse;
import com.zstrm.scheduler.api.response.SessionResponse;
import com.zstrm.scheduler.service.ScheduleService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class ScheduleController {

  private final ScheduleService scheduleService;

  @PostMapping("/schedules")
  public ResponseEntity<ScheduleResponse> createSchedule(
      @Valid @RequestBody CreateScheduleRequest request) {
    return ResponseEntity.ok(scheduleService.createSchedule(request));
  }

  @GetMapping("/schedules")
  public ResponseEntity<List<ScheduleResponse>> listSchedules() {
    return ResponseEntity.ok(scheduleService.listSchedules());
  }

  @PostMapping("/run-now")
  public ResponseEntity<SessionResponse> runNow(@Valid @RequestBody RunNowRequest request) {
    return ResponseEntity.ok(scheduleService.runNow(request));
  }
}

/*
 * Where: scheduler API tests
 * What: schedule creation and the run-now endpoint
 * Why: run-now errors must map to 404, 409 or 400 instead of a server error
 */
package com.zstrm.scheduler.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.zstrm.scheduler.api.request.CreateScheduleRequest;
import com.zstrm.scheduler.api.request.RunNowRequest;
import com.zstrm.scheduler.api.response.ScheduleResponse;
import com.zstrm.scheduler.api.response.SessionResponse;
import com.zstrm.scheduler.service.RunnerIdentity;
import com.zstrm.scheduler.service.ScheduleService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ScheduleController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class ScheduleControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private ScheduleService scheduleService;
  @MockitoBean private RunnerIdentity runnerIdentity;

  @Test
  void createScheduleAcceptsLowerCaseMode() throws Exception {
    when(scheduleService.createSchedule(any(CreateScheduleRequest.class)))
        .thenReturn(
            new ScheduleResponse(
                5L, 7L, NOW, null, 30, "WINDOWED", true, false, NOW, null));

    mockMvc
        .perform(
            post("/v1/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"job_id":7,"starts_at":"2026-03-01T12:00:00Z","duration_minutes":30,
                    "mode":"windowed","loop":true}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.schedule_id").value(5))
        .andExpect(jsonPath("$.mode").value("WINDOWED"))
        .andExpect(jsonPath("$.loop").value(true));
  }

  @Test
  void createScheduleRejectsNonPositiveDuration() throws Exception {
    mockMvc
        .perform(
            post("/v1/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"job_id\":7,\"starts_at\":\"2026-03-01T12:00:00Z\",\"duration_minutes\":0}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
  }

  @Test
  void listSchedulesReturnsAll() throws Exception {
    when(scheduleService.listSchedules())
        .thenReturn(
            List.of(new ScheduleResponse(5L, 7L, NOW, null, null, "ONE_TIME", false, true, NOW, NOW)));

    mockMvc
        .perform(get("/v1/schedules"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].run_now").value(true))
        .andExpect(jsonPath("$[0].last_run_at").value("2026-03-01T12:00:00Z"));
  }

  @Test
  void runNowReturnsStartedSession() throws Exception {
    when(scheduleService.runNow(any(RunNowRequest.class)))
        .thenReturn(
            new SessionResponse(
                42L, 5L, 7L, NOW, NOW, "COMPLETED", "ffmpeg -re -c copy", null));

    mockMvc
        .perform(
            post("/v1/run-now")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"job_id\":7}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.session_id").value(42))
        .andExpect(jsonPath("$.status").value("COMPLETED"))
        .andExpect(jsonPath("$.pipeline_description").value("ffmpeg -re -c copy"));
  }

  @Test
  void runNowReturns409WhenNothingStarted() throws Exception {
    when(scheduleService.runNow(any(RunNowRequest.class)))
        .thenThrow(new RunNowConflictException("job 7 did not start: Hot swap requires Premium"));

    mockMvc
        .perform(
            post("/v1/run-now")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"job_id\":7}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("CONFLICT"))
        .andExpect(jsonPath("$.message").value("job 7 did not start: Hot swap requires Premium"));
  }

  @Test
  void runNowReturns404ForUnknownJob() throws Exception {
    when(scheduleService.runNow(any(RunNowRequest.class)))
        .thenThrow(new ResourceNotFoundException("job", 404L));

    mockMvc
        .perform(
            post("/v1/run-now")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"job_id\":404}"))
        .andExpect(status().isNotFound());
  }

  @Test
  void unexpectedErrorIsReportedAsInternalError() throws Exception {
    when(scheduleService.listSchedules()).thenThrow(new IllegalStateException("db down"));

    mockMvc
        .perform(get("/v1/schedules"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
        .andExpect(jsonPath("$.message").value("internal error"));
  }
}

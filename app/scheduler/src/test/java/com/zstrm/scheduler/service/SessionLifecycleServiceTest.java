package com.zstrm.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.zstrm.scheduler.model.EventLogRecord;
import com.zstrm.scheduler.model.EventType;
import com.zstrm.scheduler.model.ExecutionOutcome;
import com.zstrm.scheduler.model.JobRecord;
import com.zstrm.scheduler.model.JobStatus;
import com.zstrm.scheduler.model.ScheduleMode;
import com.zstrm.scheduler.model.ScheduleRecord;
import com.zstrm.scheduler.model.SessionRecord;
import com.zstrm.scheduler.repository.EventLogRepository;
import com.zstrm.scheduler.repository.JobRepository;
import com.zstrm.scheduler.repository.ScheduleRepository;
import com.zstrm.scheduler.repository.SessionRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionLifecycleServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final String PIPELINE = "ffmpeg -re -c copy // preset=p // audio -> rtmp://x";

  @Mock private SessionRepository sessionRepository;
  @Mock private JobRepository jobRepository;
  @Mock private ScheduleRepository scheduleRepository;
  @Mock private EventLogRepository eventLogRepository;
  @Mock private PipelineDescriptionRenderer pipelineRenderer;
  @Mock private SchedulerMetrics metrics;

  private SessionLifecycleService service;

  @BeforeEach
  void setUp() {
    service =
        new SessionLifecycleService(
            sessionRepository,
            jobRepository,
            scheduleRepository,
            eventLogRepository,
            pipelineRenderer,
            metrics,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void startOpensRunningSessionAndRecordsStartedEvent() {
    final JobRecord job = JobLicenseGateTest.job(10L, 3L, JobStatus.PENDING);
    final ScheduleRecord schedule =
        new ScheduleRecord(
            5L, 10L, NOW.minusSeconds(60), null, null, ScheduleMode.ONE_TIME, false, false, NOW,
            null);
    when(pipelineRenderer.render(job)).thenReturn(PIPELINE);
    when(sessionRepository.insert(any())).thenReturn(42L);

    final SessionRecord session = service.start(schedule, job);

    assertThat(session.sessionId()).isEqualTo(42L);
    assertThat(session.status()).isEqualTo(JobStatus.RUNNING);
    assertThat(session.pipelineDescription()).isEqualTo(PIPELINE);
    verify(jobRepository).updateStatus(10L, JobStatus.RUNNING, null, NOW);
    verify(scheduleRepository).markRun(5L, NOW);
    final ArgumentCaptor<EventLogRecord> event = ArgumentCaptor.forClass(EventLogRecord.class);
    verify(eventLogRepository).append(event.capture(), eq(NOW));
    assertThat(event.getValue().eventType()).isEqualTo(EventType.STARTED);
    assertThat(event.getValue().sessionId()).isEqualTo(42L);
    assertThat(event.getValue().message()).isEqualTo("Session started with pipeline " + PIPELINE);
    verify(metrics).recordSessionStarted();
  }

  @Test
  void completeMarksSessionAndJobFailedWithReason() {
    when(sessionRepository.findById(42L)).thenReturn(Optional.of(running()));
    when(sessionRepository.complete(42L, JobStatus.FAILED, NOW, "boom")).thenReturn(1);

    assertThat(service.complete(42L, ExecutionOutcome.failed("boom"))).isTrue();

    verify(jobRepository).updateStatusIf(10L, JobStatus.RUNNING, JobStatus.FAILED, NOW);
    final ArgumentCaptor<EventLogRecord> event = ArgumentCaptor.forClass(EventLogRecord.class);
    verify(eventLogRepository).append(event.capture(), eq(NOW));
    assertThat(event.getValue().eventType()).isEqualTo(EventType.STOPPED);
    assertThat(event.getValue().message()).isEqualTo("Session failed: boom");
  }

  @Test
  void completeToleratesDeletedSession() {
    when(sessionRepository.findById(42L)).thenReturn(Optional.empty());

    assertThat(service.complete(42L, ExecutionOutcome.succeeded())).isFalse();

    verify(sessionRepository, never()).complete(anyLong(), any(), any(), any());
    verifyNoInteractions(jobRepository, eventLogRepository);
  }

  @Test
  void completeIgnoresAlreadyEndedSession() {
    final SessionRecord ended =
        new SessionRecord(
            42L, 5L, 10L, NOW.minusSeconds(5), NOW, JobStatus.COMPLETED, PIPELINE, null);
    when(sessionRepository.findById(42L)).thenReturn(Optional.of(ended));

    assertThat(service.complete(42L, ExecutionOutcome.succeeded())).isFalse();

    verifyNoInteractions(jobRepository, eventLogRepository);
  }

  private static SessionRecord running() {
    return new SessionRecord(
        42L, 5L, 10L, NOW.minusSeconds(5), null, JobStatus.RUNNING, PIPELINE, null);
  }
}

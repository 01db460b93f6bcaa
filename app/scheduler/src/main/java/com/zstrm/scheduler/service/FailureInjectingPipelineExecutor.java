/*
 * Where: scheduler service layer
 * What: CI/test-only executor that reports failure for selected jobs
 * Why: lets end-to-end runs reach the FAILED session path without touching real code paths
 */
package com.zstrm.scheduler.service;

import com.zstrm.scheduler.model.ExecutionOutcome;
import com.zstrm.scheduler.model.SessionRecord;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "scheduler.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingPipelineExecutor implements PipelineExecutor {

  static final String INJECTED_REASON = "pipeline failure injected";

  private final SimulatedPipelineExecutor delegate;

  @Value("${scheduler.failure-injection.job-ids:}")
  private List<Long> jobIds;

  @Override
  public ExecutionOutcome execute(SessionRecord session) {
    if (jobIds != null && jobIds.contains(session.jobId())) {
      return ExecutionOutcome.failed(INJECTED_REASON);
    }
    return delegate.execute(session);
  }
}

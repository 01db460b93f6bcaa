/*
 * Where: scheduler service layer
 * What: pipeline executor that only logs the rendered plan
 * Why: session bookkeeping can be exercised without launching media processes
 */
package com.zstrm.scheduler.service;

import com.zstrm.scheduler.model.ExecutionOutcome;
import com.zstrm.scheduler.model.SessionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SimulatedPipelineExecutor implements PipelineExecutor {

  private static final Logger logger = LoggerFactory.getLogger(SimulatedPipelineExecutor.class);

  @Override
  public ExecutionOutcome execute(SessionRecord session) {
    logger.info(
        "pipeline simulated sessionId={} jobId={} pipeline={}",
        session.sessionId(),
        session.jobId(),
        session.pipelineDescription());
    return ExecutionOutcome.succeeded();
  }
}

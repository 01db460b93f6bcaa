/*
 * Where: scheduler service layer
 * What: runs (or stands in for) the pipeline of a started session
 * Why: session completion status comes from whoever executes the pipeline
 */
package com.zstrm.scheduler.service;

import com.zstrm.scheduler.model.ExecutionOutcome;
import com.zstrm.scheduler.model.SessionRecord;

public interface PipelineExecutor {

  ExecutionOutcome execute(SessionRecord session);
}

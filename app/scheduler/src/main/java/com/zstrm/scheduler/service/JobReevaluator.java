package com.zstrm.scheduler.service;

/** Re-applies the license gate to every job after the tier drops. */
public interface JobReevaluator {

  void reevaluateAll();
}

package com.zstrm.scheduler.model;

public enum EventType {
  STARTED,
  STOPPED,
  RETRY,
  INVALIDATED,
  DOWNGRADED,
  UPGRADED
}

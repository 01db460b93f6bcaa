package com.zstrm.scheduler.model;

public enum ScheduleMode {
  ONE_TIME,
  WINDOWED
}

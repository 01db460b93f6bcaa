package com.zstrm.scheduler.model;

public enum HotSwapMode {
  NONE,
  IMMEDIATE,
  NEXT_LOOP
}

package com.zstrm.scheduler.model;

public enum AudioReplaceMode {
  NONE,
  EXTERNAL_LOOP,
  VIDEO_ONLY
}

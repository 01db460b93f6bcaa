package com.zstrm.scheduler.model;

public enum PresetType {
  COPY,
  ENCODE
}

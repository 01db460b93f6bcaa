package com.zstrm.common;

import java.util.UUID;

/** Trace identifiers attached to the logging MDC under {@link #MDC_KEY}. */
public final class TraceIds {

  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString().replace("-", "");
  }
}

package com.incidentdesk.common;

import java.util.UUID;

public final class TraceIds {
  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }
}

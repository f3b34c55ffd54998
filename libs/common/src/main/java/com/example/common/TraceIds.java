package com.example.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String MDC_TRACE_ID = "trace_id";
  public static final String MDC_REQUEST_ID = "request_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** 現在のリクエストに紐づく trace を返す。MDC に無ければ request_id、それも無ければ新規採番。 */
  public static String currentOrNew() {
    final String traceId = MDC.get(MDC_TRACE_ID);
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    final String requestId = MDC.get(MDC_REQUEST_ID);
    if (requestId != null && !requestId.isBlank()) {
      return requestId;
    }
    return newTraceId();
  }
}

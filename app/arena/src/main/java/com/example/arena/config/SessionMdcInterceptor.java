/*
 * どこで: Arena Web 層
 * 何を: リクエスト ID・トレース ID・利用者・対象セッション・ルートを MDC へ積み、応答に request_id を返す
 * なぜ: 1 つのセッションに対する HTTP 操作と、その後の outbox 配信ログを同じキーで辿れるようにするため
 */
package com.example.arena.config;

import com.example.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class SessionMdcInterceptor implements HandlerInterceptor {

  static final String HEADER_REQUEST_ID = "X-Request-Id";
  static final String HEADER_TRACE_ID = "X-Trace-Id";
  static final String HEADER_USER_ID = "X-User-Id";
  static final String MDC_USER_ID = "user_id";
  static final String MDC_SESSION_ID = "session_id";
  static final String MDC_ROUTE = "route";

  private static final String PREVIOUS_CONTEXT =
      SessionMdcInterceptor.class.getName() + ".PREVIOUS_CONTEXT";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Map<String, String> previous = MDC.getCopyOfContextMap();
    if (previous != null) {
      request.setAttribute(PREVIOUS_CONTEXT, previous);
    }
    final Map<?, ?> pathVariables = pathVariables(request);
    final String requestId =
        firstNonBlank(request.getHeader(HEADER_REQUEST_ID), TraceIds.newTraceId());
    MDC.put(TraceIds.MDC_REQUEST_ID, requestId);
    // 上流がトレースを持たない場合はリクエスト ID をそのままトレースにする
    MDC.put(TraceIds.MDC_TRACE_ID, firstNonBlank(request.getHeader(HEADER_TRACE_ID), requestId));
    putIfPresent(
        MDC_USER_ID,
        firstNonBlank(request.getHeader(HEADER_USER_ID), stringValue(pathVariables, "userId")));
    putIfPresent(MDC_SESSION_ID, stringValue(pathVariables, "sessionId"));
    putIfPresent(MDC_ROUTE, route(request));
    response.setHeader(HEADER_REQUEST_ID, requestId);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    // ワーカースレッドは使い回されるので、前の値に戻すかすべて消す
    if (request.getAttribute(PREVIOUS_CONTEXT) instanceof Map<?, ?> previous) {
      @SuppressWarnings("unchecked")
      final Map<String, String> restored = (Map<String, String>) previous;
      MDC.setContextMap(restored);
    } else {
      MDC.clear();
    }
  }

  private static String route(HttpServletRequest request) {
    final Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
    if (pattern == null) {
      return request.getMethod() + " " + request.getRequestURI();
    }
    return request.getMethod() + " " + pattern;
  }

  private static Map<?, ?> pathVariables(HttpServletRequest request) {
    final Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    return attribute instanceof Map<?, ?> variables ? variables : Map.of();
  }

  private static String stringValue(Map<?, ?> variables, String name) {
    return variables.get(name) instanceof String value ? value : null;
  }

  private static String firstNonBlank(String preferred, String fallback) {
    if (preferred != null && !preferred.isBlank()) {
      return preferred;
    }
    return fallback == null || fallback.isBlank() ? null : fallback;
  }

  private static void putIfPresent(String key, String value) {
    if (value != null) {
      MDC.put(key, value);
    }
  }
}

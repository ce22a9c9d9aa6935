package com.example.hotelops.notification.config;

import com.example.hotelops.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String HEADER_REQUEST_ID = "X-Request-Id";
  static final String HEADER_TRACE_ID = "X-Trace-Id";
  static final String HEADER_FORWARDED_FOR = "X-Forwarded-For";

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    final String requestId = TraceIds.orNew(request.getHeader(HEADER_REQUEST_ID));
    put(keys, "request_id", requestId);
    put(keys, "trace_id", request.getHeader(HEADER_TRACE_ID));
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", resolveClientIp(request));
    response.setHeader(HEADER_REQUEST_ID, requestId);
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (!(request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> rawKeys)) {
      return;
    }
    rawKeys.stream().filter(String.class::isInstance).map(String.class::cast).forEach(MDC::remove);
  }

  private String resolveClientIp(HttpServletRequest request) {
    final String forwardedFor = request.getHeader(HEADER_FORWARDED_FOR);
    if (forwardedFor == null || forwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    // first hop is the original client
    return forwardedFor.split(",", 2)[0].trim();
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}

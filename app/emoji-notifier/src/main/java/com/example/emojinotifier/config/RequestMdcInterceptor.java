/*
 * Where: emoji-notifier web layer
 * What: Tags command and debug requests with correlation keys in the MDC
 * Why: A register/unregister reply and its directory log lines share one request id
 */
package com.example.emojinotifier.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
  private static final String GUILD_ID_VARIABLE = "guildId";
  private static final List<String> KEYS =
      List.of("request_id", "http_method", "http_path", "client_ip", "guild_id");

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final String requestId = firstNonBlank(request.getHeader(REQUEST_ID_HEADER));
    final String effectiveId = requestId != null ? requestId : UUID.randomUUID().toString();
    putIfPresent("request_id", effectiveId);
    putIfPresent("http_method", request.getMethod());
    putIfPresent("http_path", request.getRequestURI());
    putIfPresent("client_ip", clientIp(request));
    putIfPresent("guild_id", pathGuildId(request));
    response.setHeader(REQUEST_ID_HEADER, effectiveId);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    KEYS.forEach(MDC::remove);
  }

  private String clientIp(HttpServletRequest request) {
    final String forwarded = firstNonBlank(request.getHeader(FORWARDED_FOR_HEADER));
    if (forwarded == null) {
      return request.getRemoteAddr();
    }
    // left-most entry is the originating client
    return forwarded.split(",", 2)[0].trim();
  }

  @SuppressWarnings("unchecked")
  private String pathGuildId(HttpServletRequest request) {
    final Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    if (variables instanceof Map<?, ?> map) {
      final Object guildId = ((Map<String, Object>) map).get(GUILD_ID_VARIABLE);
      return guildId == null ? null : guildId.toString();
    }
    return null;
  }

  private String firstNonBlank(String value) {
    return value == null || value.isBlank() ? null : value;
  }

  private void putIfPresent(String key, String value) {
    if (value != null && !value.isBlank()) {
      MDC.put(key, value);
    }
  }
}

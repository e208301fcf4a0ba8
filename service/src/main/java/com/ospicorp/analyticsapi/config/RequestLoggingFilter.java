package com.ospicorp.analyticsapi.config;

import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * One access-log line per request, written when the response is complete (after the async
 * dispatch for analytics endpoints). Every request carries a {@code requestId} in the MDC and
 * the {@code X-Request-Id} response header.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String REQUEST_ID_KEY = "requestId";

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    long startTime = System.currentTimeMillis();
    String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (!StringUtils.hasText(requestId)) {
      requestId = UUID.randomUUID().toString();
    }
    MDC.put(REQUEST_ID_KEY, requestId);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} from {} failed: {}",
          request.getMethod(),
          request.getRequestURI(),
          clientIp(request),
          ex.getMessage(),
          ex);
      throw ex;
    } finally {
      if (request.isAsyncStarted()) {
        request.getAsyncContext().addListener(new CompletionLogger(request, response, startTime,
            requestId));
      } else {
        logCompletion(request, response, startTime);
      }
      MDC.remove(REQUEST_ID_KEY);
    }
  }

  static String clientIp(HttpServletRequest request) {
    String forwardedHeader = request.getHeader("X-Forwarded-For");
    if (forwardedHeader != null && !forwardedHeader.isBlank()) {
      return forwardedHeader.split(",")[0].trim();
    }
    return request.getRemoteAddr();
  }

  private static void logCompletion(HttpServletRequest request, HttpServletResponse response,
      long startTime) {
    long duration = System.currentTimeMillis() - startTime;
    log.info("HTTP {} {} from {} -> {} ({} ms, {} bytes in)",
        request.getMethod(),
        request.getRequestURI(),
        clientIp(request),
        response.getStatus(),
        duration,
        Math.max(request.getContentLengthLong(), 0L));
  }

  private record CompletionLogger(HttpServletRequest request, HttpServletResponse response,
      long startTime, String requestId) implements AsyncListener {

    @Override
    public void onComplete(AsyncEvent event) {
      MDC.put(REQUEST_ID_KEY, requestId);
      try {
        logCompletion(request, response, startTime);
      } finally {
        MDC.remove(REQUEST_ID_KEY);
      }
    }

    @Override
    public void onTimeout(AsyncEvent event) {
      log.warn("Request {} {} [{}] timed out", request.getMethod(), request.getRequestURI(),
          requestId);
    }

    @Override
    public void onError(AsyncEvent event) {
      log.warn("Request {} {} [{}] failed during async processing: {}", request.getMethod(),
          request.getRequestURI(), requestId, event.getThrowable() == null ? "unknown"
              : event.getThrowable().getMessage());
    }

    @Override
    public void onStartAsync(AsyncEvent event) {
      event.getAsyncContext().addListener(this);
    }
  }
}

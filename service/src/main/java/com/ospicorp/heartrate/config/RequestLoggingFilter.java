package com.ospicorp.heartrate.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/** Access log line per request, tagged with a request id carried in the MDC and echoed back. */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);
  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String MDC_REQUEST_ID = "request_id";

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
      @NonNull FilterChain filterChain) throws ServletException, IOException {
    String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (!StringUtils.hasText(requestId)) {
      requestId = UUID.randomUUID().toString();
    }
    MDC.put(MDC_REQUEST_ID, requestId);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    long startTime = System.currentTimeMillis();
    try {
      filterChain.doFilter(request, response);
    } finally {
      log.info("HTTP {} -> {} ({} ms)", describe(request), response.getStatus(),
          System.currentTimeMillis() - startTime);
      MDC.remove(MDC_REQUEST_ID);
    }
  }

  static String describe(HttpServletRequest request) {
    String uri = request.getRequestURI();
    String queryString = request.getQueryString();
    if (StringUtils.hasText(queryString)) {
      uri = uri + "?" + queryString;
    }
    return request.getMethod() + " " + uri + " from " + clientIp(request);
  }

  private static String clientIp(HttpServletRequest request) {
    String forwardedHeader = request.getHeader("X-Forwarded-For");
    if (StringUtils.hasText(forwardedHeader)) {
      return forwardedHeader.split(",")[0].trim();
    }
    return request.getRemoteAddr();
  }
}

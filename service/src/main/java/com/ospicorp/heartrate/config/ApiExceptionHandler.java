package com.ospicorp.heartrate.config;

import com.ospicorp.heartrate.web.InvalidParameterException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to HTTP responses. Parameter errors carry their code and
 * message; server errors expose only a generic message and are logged in full.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);
  private static final String PROBLEM_TYPE_BASE = "https://docs.heartrate-api.dev/problems/";
  private static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.UNAUTHORIZED, "unauthorized",
      HttpStatus.FORBIDDEN, "forbidden",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler(InvalidParameterException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidParameter(InvalidParameterException ex,
      HttpServletRequest request) {
    logException(HttpStatus.BAD_REQUEST, ex, request);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", ex.getMessage());
    body.put("errorCode", ex.errorCode());
    body.put("moreInfo", ex.moreInfo());
    body.put("path", request.getRequestURI());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class,
      MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class,
      IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex.getMessage(), ex, request);
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(NoResourceFoundException ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, "No endpoint " + request.getRequestURI(), ex, request);
  }

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<ProblemDetail> handleUnauthorized(AuthenticationException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.UNAUTHORIZED, ex.getMessage(), ex, request);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(AccessDeniedException ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.FORBIDDEN, ex.getMessage(), ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR_MESSAGE, ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, String message, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, message);
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create(PROBLEM_TYPE_BASE + TYPE_SLUGS.getOrDefault(status, "internal-error")));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }
    String target = RequestLoggingFilter.describe(request);
    if (status.is5xxServerError()) {
      log.error("Request {} failed with status {}: {}", target, status.value(), errorMessage, ex);
    } else {
      log.warn("Request {} returned status {}: {}", target, status.value(), errorMessage);
    }
  }
}

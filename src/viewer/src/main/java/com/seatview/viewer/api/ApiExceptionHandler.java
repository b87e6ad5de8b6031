package com.seatview.viewer.api;

import com.seatview.mapper.camera.SectionResolutionException;
import com.seatview.viewer.render.RenderException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Centralized REST exception mapping for the seat view API.
 *
 * <p>Known domain and render failures are converted into stable JSON error payloads.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);
  static final long RETRY_AFTER_SECONDS = 5L;

  @ExceptionHandler({
      BadRequestException.class,
      IllegalArgumentException.class,
      MethodArgumentTypeMismatchException.class,
      MissingServletRequestParameterException.class})
  public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
    return ResponseEntity.badRequest().body(error("bad_request", ex.getMessage()));
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("not_found", ex.getMessage()));
  }

  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<Map<String, Object>> handleMissingRoute(Exception ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(error("not_found", "resource not found"));
  }

  /**
   * Maps render failures. Retryable ones become 503 with a retry hint, the rest 502.
   *
   * @param ex render failure shared by every caller of the same view
   * @return standardized error payload
   */
  @ExceptionHandler(RenderException.class)
  public ResponseEntity<Map<String, Object>> handleRender(RenderException ex) {
    if (ex.isRetryable()) {
      Map<String, Object> body = error("view_unavailable", "view unavailable, retry");
      body.put("retryable", true);
      body.put("retryAfterSeconds", RETRY_AFTER_SECONDS);
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
          .header(HttpHeaders.RETRY_AFTER, Long.toString(RETRY_AFTER_SECONDS))
          .body(body);
    }
    Map<String, Object> body = error("render_failed", ex.getMessage());
    body.put("retryable", false);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
  }

  @ExceptionHandler(SectionResolutionException.class)
  public ResponseEntity<Map<String, Object>> handleSectionResolution(SectionResolutionException ex) {
    log.error("Section resolution failed for venue {}", ex.getVenueId(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(error("section_resolution_failed", ex.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
    log.error("Unhandled API error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(error("internal_error", "internal server error"));
  }

  private Map<String, Object> error(String code, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", code);
    body.put("message", message == null ? "" : message);
    body.put("timestamp", Instant.now().toString());
    return body;
  }
}

package io.whalewatch.signalbackend.controller;

import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ServerWebInputException;

@RestControllerAdvice(basePackages = "io.whalewatch.signalbackend.controller")
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({
    ConstraintViolationException.class,
    HandlerMethodValidationException.class,
    ServerWebInputException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<Map<String, Object>> onBadRequest(Exception e) {
    return ResponseEntity.badRequest()
        .body(
            Map.of(
                "ok", false,
                "code", "BAD_REQUEST",
                "message", e.getMessage() == null ? "Invalid request" : e.getMessage(),
                "timestamp", Instant.now().toEpochMilli()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> onUnknown(Exception e) {
    log.error("dashboard api internal error", e);
    return ResponseEntity.status(500)
        .body(
            Map.of(
                "ok", false,
                "code", "INTERNAL_ERROR",
                "message", "Internal server error",
                "timestamp", Instant.now().toEpochMilli()));
  }
}

package io.statusmvp.tokenbalances.controller;

import io.statusmvp.tokenbalances.error.ApiException;
import io.statusmvp.tokenbalances.model.ErrorBody;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ServerWebInputException;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ApiException.class)
  public ResponseEntity<ErrorBody> onApiError(ApiException e) {
    if (e.getHttpStatus() >= 500) {
      log.warn("request failed with {}: {}", e.getHttpStatus(), e.getMessage(), e.getCause());
    }
    return ResponseEntity.status(e.getHttpStatus()).body(new ErrorBody(e.getMessage()));
  }

  @ExceptionHandler({
    ConstraintViolationException.class,
    WebExchangeBindException.class,
    ServerWebInputException.class,
    HandlerMethodValidationException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<ErrorBody> onBadRequest(Exception e) {
    return ResponseEntity.badRequest()
        .body(new ErrorBody(e.getMessage() == null ? "Invalid request" : e.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorBody> onUnknown(Exception e) {
    log.error("internal error", e);
    return ResponseEntity.status(500).body(new ErrorBody("Internal server error"));
  }
}

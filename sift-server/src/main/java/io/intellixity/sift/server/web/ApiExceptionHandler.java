package io.intellixity.sift.server.web;

import io.intellixity.sift.selector.SelectorValidationException;
import io.intellixity.sift.server.service.UnsupportedAggregateException;
import io.intellixity.sift.spi.schema.SchemaValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/** Request-shape failures become 400 {"error": message}; nothing of the request ran. */
@RestControllerAdvice
public final class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(SchemaValidationException.class)
  public ResponseEntity<Map<String, String>> schema(SchemaValidationException e) {
    log.debug("Schema check failed for table '{}': {}", e.table(), e.getMessage());
    return badRequest(e.getMessage());
  }

  @ExceptionHandler(SelectorValidationException.class)
  public ResponseEntity<Map<String, String>> selector(SelectorValidationException e) {
    log.debug("Selector rejected: {}", e.getMessage());
    return badRequest(e.getMessage());
  }

  @ExceptionHandler(UnsupportedAggregateException.class)
  public ResponseEntity<Map<String, String>> aggregate(UnsupportedAggregateException e) {
    return badRequest(e.getMessage());
  }

  private static ResponseEntity<Map<String, String>> badRequest(String message) {
    return ResponseEntity.badRequest().body(Map.of("error", message == null ? "Bad request" : message));
  }
}

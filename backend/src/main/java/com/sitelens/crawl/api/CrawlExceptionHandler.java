package com.sitelens.crawl.api;

import com.sitelens.crawl.service.CrawlNotFoundException;
import com.sitelens.crawl.service.CrawlNotRetryableException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(CrawlNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(CrawlNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "crawl_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(CrawlNotRetryableException.class)
  public ResponseEntity<Map<String, String>> handleNotRetryable(CrawlNotRetryableException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "crawl_not_retryable", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException ex) {
    String message = ex.getMessage() == null ? "invalid request" : ex.getMessage();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", message));
  }
}

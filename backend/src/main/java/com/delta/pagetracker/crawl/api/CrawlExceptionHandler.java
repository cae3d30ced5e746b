package com.delta.pagetracker.crawl.api;

import com.delta.pagetracker.crawl.service.ActiveCrawlRunException;
import com.delta.pagetracker.crawl.service.JobNotFoundException;
import com.delta.pagetracker.crawl.service.JobValidationException;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(ActiveCrawlRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveCrawlRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_crawl_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(JobValidationException.class)
  public ResponseEntity<Map<String, String>> handleValidation(JobValidationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "validation_failed", "message", ex.getMessage()));
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<Map<String, String>> handleMissingHeader(MissingRequestHeaderException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "validation_failed", "message", ex.getHeaderName() + " header is required"));
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(JobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(RejectedExecutionException.class)
  public ResponseEntity<Map<String, String>> handleRejected(RejectedExecutionException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "run_capacity_exhausted", "message", "No run slot available; retry later"));
  }
}

package com.delta.creatorscout.discovery.api;

import com.delta.creatorscout.discovery.engine.JobNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@RestControllerAdvice
public class DiscoveryExceptionHandler {

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleJobNotFound(JobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "job_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<Map<String, String>> handleStatus(ResponseStatusException ex) {
    String reason = ex.getReason() == null ? ex.getStatusCode().toString() : ex.getReason();
    String error = ex.getStatusCode().value() == HttpStatus.BAD_REQUEST.value() ? "invalid_request" : "request_failed";
    return ResponseEntity.status(ex.getStatusCode()).body(Map.of("error", error, "message", reason));
  }

  @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
  public ResponseEntity<Map<String, String>> handleUnreadable(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", "Malformed request"));
  }
}

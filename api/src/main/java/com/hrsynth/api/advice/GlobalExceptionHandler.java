package com.hrsynth.api.advice;

import com.hrsynth.api.exception.AlignmentException;
import com.hrsynth.api.exception.ConfigurationException;
import com.hrsynth.api.exception.DataIntegrityException;
import com.hrsynth.api.model.ApiResponse;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
    List<String> details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(err -> err.getField() + ": " + err.getDefaultMessage())
            .toList();
    log.warn("Validation error: {}", details);
    return ResponseEntity.badRequest().body(ApiResponse.error("Validation failed", details));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    String errorMsg =
        String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName());
    log.warn("Type mismatch: {}", errorMsg);
    return ResponseEntity.badRequest().body(ApiResponse.error(errorMsg));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException ex) {
    log.warn("Malformed request body: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(ApiResponse.error("Malformed request body"));
  }

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<ApiResponse<Void>> handleConfiguration(ConfigurationException ex) {
    log.warn("Invalid generation parameters: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(ApiResponse.error(ex.getMessage()));
  }

  @ExceptionHandler(AlignmentException.class)
  public ResponseEntity<ApiResponse<Void>> handleAlignment(AlignmentException ex) {
    log.warn("Reference data misaligned (family {}): {}", ex.getJobFamily(), ex.getMessage());
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(ApiResponse.error(ex.getMessage()));
  }

  @ExceptionHandler(DataIntegrityException.class)
  public ResponseEntity<ApiResponse<Void>> handleIntegrity(DataIntegrityException ex) {
    log.error("Generated dataset failed integrity checks: {}", ex.getViolations());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiResponse.error("An unexpected error occurred"));
  }

  @ExceptionHandler(BulkheadFullException.class)
  public ResponseEntity<ApiResponse<Void>> handleServiceUnavailable(BulkheadFullException ex) {
    log.error("Service unavailable: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ApiResponse.error("Service temporarily unavailable"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
    log.error("Unexpected error: {}", ex.getMessage(), ex);

    String message = "An unexpected error occurred";

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.error(message));
  }
}

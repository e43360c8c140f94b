package com.aina.backend.common.exception;

import com.aina.backend.llm.exception.ContextWindowExceededException;
import com.aina.backend.llm.exception.ProviderException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("S'ha produït un error inesperat. Torneu-ho a provar més tard.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
  public ResponseEntity<ProblemDetail> handleValidationErrors(Exception ex) {
    return badRequest("Validation failed", resolveValidationMessage(ex));
  }

  @ExceptionHandler({
    ConstraintViolationException.class,
    HandlerMethodValidationException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ProblemDetail> handleMalformedRequest(Exception ex) {
    return badRequest("Validation failed", "Invalid request payload");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest("Invalid request", ex.getMessage());
  }

  @ExceptionHandler(ContextWindowExceededException.class)
  public ResponseEntity<ProblemDetail> handleContextWindowExceeded(ContextWindowExceededException ex) {
    log.warn("Rejected oversized prompt: {}", ex.getMessage());
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.PAYLOAD_TOO_LARGE);
    problem.setTitle("Context window exceeded");
    problem.setDetail(ex.getMessage());
    problem.setProperty("promptTokens", ex.promptTokens());
    problem.setProperty("maxTokens", ex.maxTokens());
    problem.setProperty("provider", ex.providerId());
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(problem);
  }

  @ExceptionHandler(ProviderException.class)
  public ResponseEntity<ProblemDetail> handleProviderException(ProviderException ex) {
    HttpStatus status =
        switch (ex.reason()) {
          case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
          case NETWORK -> HttpStatus.SERVICE_UNAVAILABLE;
          case RATE_LIMIT -> HttpStatus.TOO_MANY_REQUESTS;
          default -> HttpStatus.BAD_GATEWAY;
        };
    log.warn("Provider call failed: {}", ex.getMessage());
    ProblemDetail problem = ProblemDetail.forStatus(status);
    problem.setTitle("Provider error");
    problem.setDetail(ex.getMessage());
    problem.setProperty("provider", ex.providerId());
    problem.setProperty("reason", ex.reason().name().toLowerCase());
    if (ex.status() != null) {
      problem.setProperty("upstreamStatus", ex.status());
    }
    return ResponseEntity.status(status).body(problem);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  private ResponseEntity<ProblemDetail> badRequest(String title, String detail) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    return ResponseEntity.badRequest().body(problem);
  }

  private String resolveValidationMessage(Exception ex) {
    if (ex instanceof MethodArgumentNotValidException methodArgumentNotValidException) {
      return methodArgumentNotValidException.getBindingResult().getFieldErrors().stream()
          .findFirst()
          .map(error -> error.getField() + ": " + (error.getDefaultMessage() != null ? error.getDefaultMessage() : "invalid"))
          .orElse("Invalid request payload");
    }
    if (ex instanceof BindException bindException) {
      return bindException.getBindingResult().getAllErrors().stream()
          .findFirst()
          .map(error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid request payload")
          .orElse("Invalid request payload");
    }
    return "Invalid request payload";
  }
}

package com.flamingo.ai.agentchat.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for the display-layer controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(GenerationInProgressException.class)
  public ResponseEntity<ApiError> handleGenerationInProgress(
      GenerationInProgressException ex, HttpServletRequest request) {

    incrementErrorCounter("generation_in_progress");
    String errorId = generateErrorId();
    log.warn("Send rejected [{}]: generation {} still running", errorId, ex.getPlaceholderId());

    return error(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.GENERATION_IN_PROGRESS,
        "A response is still being generated. Stop it or wait before sending again.",
        request);
  }

  @ExceptionHandler(AgentBackendException.class)
  public ResponseEntity<ApiError> handleAgentBackend(
      AgentBackendException ex, HttpServletRequest request) {

    boolean sessionFailure = ex instanceof SessionCreationException;
    incrementErrorCounter(sessionFailure ? "session_creation" : "agent_unavailable");
    String errorId = generateErrorId();
    log.error("Agent backend error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.BAD_GATEWAY,
        errorId,
        sessionFailure ? ApiError.SESSION_CREATION_FAILED : ApiError.AGENT_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return error(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> error(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}

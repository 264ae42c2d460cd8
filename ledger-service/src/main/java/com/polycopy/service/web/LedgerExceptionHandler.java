package com.polycopy.service.web;

import com.polycopy.error.InconsistentStateException;
import com.polycopy.error.InvalidEventException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps ledger rejections to HTTP answers. The rejection itself is already logged and counted by the processor.
 */
@RestControllerAdvice
public class LedgerExceptionHandler {

  @ExceptionHandler(InvalidEventException.class)
  public ResponseEntity<ErrorResponse> invalidEvent(InvalidEventException e) {
    return respond(HttpStatus.BAD_REQUEST, "INVALID_EVENT", e.getMessage());
  }

  @ExceptionHandler(InconsistentStateException.class)
  public ResponseEntity<ErrorResponse> inconsistentState(InconsistentStateException e) {
    return respond(HttpStatus.CONFLICT, "INCONSISTENT_STATE", e.getMessage());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> unreadable(HttpMessageNotReadableException e) {
    return respond(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Malformed request body");
  }

  private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(error, message));
  }

  public record ErrorResponse(
      String error,
      String message
  ) {
  }
}

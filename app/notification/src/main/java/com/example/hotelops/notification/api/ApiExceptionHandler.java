/*
 * Where: Notification API error mapping
 * What: Translates service exceptions into {code, message} bodies
 * Why: Callers branch on the code, never on exception class names
 */
package com.example.hotelops.notification.api;

import com.example.hotelops.notification.service.BatchNotFoundException;
import com.example.hotelops.notification.service.BatchStoreException;
import com.example.hotelops.notification.service.InvalidBatchRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidBatchRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleBadRequest(InvalidBatchRequestException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .orElse("invalid request");
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, "malformed request body");
  }

  @ExceptionHandler(BatchNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(BatchNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler({BatchStoreException.class, DataAccessException.class})
  public ResponseEntity<ApiErrorResponse> handleStoreError(RuntimeException ex) {
    logger.error("notification store error", ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, ApiErrorCode.STORE_ERROR, ex.getMessage());
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }
}

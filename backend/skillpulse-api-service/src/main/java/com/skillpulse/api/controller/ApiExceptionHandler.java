package com.skillpulse.api.controller;

import com.skillpulse.api.model.ApiError;
import com.skillpulse.api.service.InvalidRequestException;
import com.skillpulse.processing.store.SnapshotStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps failures to the {@code {success, message, error_type}} error body. Internal details are
 * logged, never returned.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ApiError> handleInvalid(InvalidRequestException e) {
    log.warn("Rejected request: {}", e.getMessage());
    return error(HttpStatus.BAD_REQUEST, e.getMessage(), "ValidationError");
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
    log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
    return error(HttpStatus.BAD_REQUEST, "Request body must be valid JSON", "ValidationError");
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiError> handleMissingParam(MissingServletRequestParameterException e) {
    return error(HttpStatus.BAD_REQUEST, e.getParameterName() + " is required", "ValidationError");
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ApiError> handleMethod(HttpRequestMethodNotSupportedException e) {
    return error(HttpStatus.METHOD_NOT_ALLOWED, "Method " + e.getMethod() + " not allowed", "MethodNotAllowed");
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ApiError> handleMediaType(HttpMediaTypeNotSupportedException e) {
    return error(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Content type must be application/json", "ValidationError");
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ApiError> handleNotFound(NoResourceFoundException e) {
    return error(HttpStatus.NOT_FOUND, "Resource not found", "NotFound");
  }

  @ExceptionHandler(SnapshotStorageException.class)
  public ResponseEntity<ApiError> handleStorage(SnapshotStorageException e) {
    log.error("Trend history storage failed: {}", e.getMessage(), e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "An error occurred while accessing trend history", "StorageError");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleUnexpected(Exception e) {
    log.error("Unexpected error while handling request: {}", e.getMessage(), e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "An error occurred while processing your request", "InternalError");
  }

  private static ResponseEntity<ApiError> error(HttpStatus status, String message, String type) {
    return ResponseEntity.status(status).body(ApiError.of(message, type));
  }
}

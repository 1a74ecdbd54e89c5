package com.example.todos.web.rest.errors;

import com.example.todos.exception.ApiException;
import com.example.todos.web.rest.dto.ErrorResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;
import org.springframework.http.converter.HttpMessageNotReadableException;

/**
 * Global Error Handler
 *
 * The only place failures become HTTP responses. Every body is {@code {"message": "..."}}.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalErrorHandler {

  private static final String GENERIC_MESSAGE = "An error occurred processing your request";

  private final ErrorCatalog errorCatalog;

  @ExceptionHandler(ApiException.class)
  public ResponseEntity<ErrorResponse> handleApiException(ApiException ex, WebRequest request) {
    HttpStatus status = errorCatalog.statusOf(ex.getErrorKind());
    log.debug("{} on {}: {}", ex.getErrorKind(), extractPath(request), status.value());

    return error(status, errorCatalog.messageOf(ex.getErrorKind(), ex.getDetail()));
  }

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<ErrorResponse> handleAuthenticationException(
      AuthenticationException ex, WebRequest request) {
    log.warn("Authentication error on {}: {}", extractPath(request), ex.getMessage());

    return error(HttpStatus.UNAUTHORIZED, "Authentication failed");
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ErrorResponse> handleAccessDeniedException(
      AccessDeniedException ex, WebRequest request) {
    log.warn("Access denied on {}", extractPath(request));

    return error(HttpStatus.FORBIDDEN, "Access denied");
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    log.debug("Unreadable request body: {}", ex.getMessage());

    return error(HttpStatus.BAD_REQUEST, "Malformed request body");
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ErrorResponse> handleMissingParams(
      MissingServletRequestParameterException ex) {

    return error(HttpStatus.BAD_REQUEST,
                 String.format("Missing required parameter: %s", ex.getParameterName()));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {

    return error(HttpStatus.BAD_REQUEST,
                 String.format("Invalid value for parameter: %s", ex.getName()));
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex) {

    return error(HttpStatus.METHOD_NOT_ALLOWED,
                 String.format("Method %s not supported", ex.getMethod()));
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleMediaTypeNotSupported(
      HttpMediaTypeNotSupportedException ex) {

    return error(HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                 String.format("Content type %s not supported", ex.getContentType()));
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {

    return error(HttpStatus.NOT_FOUND, String.format("No route for %s", ex.getResourcePath()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, WebRequest request) {
    log.error("Unexpected error on {}", extractPath(request), ex);

    return error(HttpStatus.INTERNAL_SERVER_ERROR, GENERIC_MESSAGE);
  }

  private ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(message));
  }

  private String extractPath(WebRequest request) {
    String description = request.getDescription(false);
    return description.replace("uri=", "");
  }
}

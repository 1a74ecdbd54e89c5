package com.example.todos.exception;

import java.util.Optional;

/**
 * API Exception
 *
 * Carries a failed {@link Outcome} from a controller or filter to the error handler.
 */
public class ApiException extends RuntimeException {

  private final ErrorKind errorKind;
  private final String detail;

  public ApiException(ErrorKind errorKind) {
    this(errorKind, null);
  }

  public ApiException(ErrorKind errorKind, String detail) {
    super(detail != null ? errorKind + ": " + detail : errorKind.name());
    this.errorKind = errorKind;
    this.detail = detail;
  }

  public ErrorKind getErrorKind() {
    return errorKind;
  }

  public Optional<String> getDetail() {
    return Optional.ofNullable(detail);
  }
}

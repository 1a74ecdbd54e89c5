package com.example.todos.exception;

/**
 * Failure kinds surfaced by the API.
 *
 * Token and credential kinds never expose per-cause detail to the client.
 */
public enum ErrorKind {
  MISSING_TOKEN(false),
  INVALID_TOKEN(false),
  EXPIRED_TOKEN(false),
  AUTHENTICATION_FAILED(false),
  VALIDATION_FAILED(true),
  NOT_FOUND(true);

  private final boolean exposesDetail;

  ErrorKind(boolean exposesDetail) {
    this.exposesDetail = exposesDetail;
  }

  public boolean exposesDetail() {
    return exposesDetail;
  }
}

package com.example.todos.exception;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a successful value or a failure tagged with an {@link ErrorKind}. Authentication,
 * authorization and domain services return this instead of throwing; the web layer turns failures
 * into an {@link ApiException} via {@link #orElseThrow()}.
 *
 * @param <T> the type of the value in case of success
 */
public final class Outcome<T> {
  private final T value;
  private final ErrorKind errorKind;
  private final String detail;

  private Outcome(T value, ErrorKind errorKind, String detail) {
    this.value = value;
    this.errorKind = errorKind;
    this.detail = detail;
  }

  /**
   * Creates a successful outcome.
   *
   * @param value the non-null value to wrap
   * @throws NullPointerException if value is null
   */
  public static <T> Outcome<T> success(T value) {
    return new Outcome<>(Objects.requireNonNull(value, "value"), null, null);
  }

  public static <T> Outcome<T> failure(ErrorKind errorKind) {
    return new Outcome<>(null, Objects.requireNonNull(errorKind, "errorKind"), null);
  }

  /**
   * Creates a failed outcome carrying a collaborator-supplied detail message. The detail is only
   * shown to clients for kinds that {@linkplain ErrorKind#exposesDetail() expose detail}.
   */
  public static <T> Outcome<T> failure(ErrorKind errorKind, String detail) {
    return new Outcome<>(null, Objects.requireNonNull(errorKind, "errorKind"), detail);
  }

  public boolean isSuccess() {
    return errorKind == null;
  }

  public boolean isFailure() {
    return errorKind != null;
  }

  /**
   * Returns the value.
   *
   * @throws IllegalStateException if this outcome is a failure
   */
  public T getValue() {
    if (isFailure()) {
      throw new IllegalStateException("Cannot get value from failed outcome: " + errorKind);
    }
    return value;
  }

  /**
   * Returns the failure kind.
   *
   * @throws IllegalStateException if this outcome is a success
   */
  public ErrorKind getErrorKind() {
    if (isSuccess()) {
      throw new IllegalStateException("Successful outcome has no error kind");
    }
    return errorKind;
  }

  public Optional<String> getDetail() {
    return Optional.ofNullable(detail);
  }

  public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
    if (isFailure()) {
      return new Outcome<>(null, errorKind, detail);
    }
    return Outcome.success(mapper.apply(value));
  }

  public <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> mapper) {
    if (isFailure()) {
      return new Outcome<>(null, errorKind, detail);
    }
    return Objects.requireNonNull(mapper.apply(value), "mapper result");
  }

  /**
   * Returns the value, or throws an {@link ApiException} carrying this failure.
   */
  public T orElseThrow() {
    if (isFailure()) {
      throw new ApiException(errorKind, detail);
    }
    return value;
  }

  @Override
  public String toString() {
    return isSuccess() ? "Outcome[success]" : "Outcome[failure=" + errorKind + "]";
  }
}

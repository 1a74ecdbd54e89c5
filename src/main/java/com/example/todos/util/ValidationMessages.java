package com.example.todos.util;

import com.example.todos.exception.ErrorKind;
import com.example.todos.exception.Outcome;
import jakarta.validation.ConstraintViolation;
import java.util.Collection;
import java.util.List;

/**
 * Builds client-facing validation messages such as
 * {@code "Validation failed: Title can't be blank, Email has already been taken"}.
 */
public final class ValidationMessages {

  private static final String PREFIX = "Validation failed: ";

  private ValidationMessages() {}

  /**
   * Turns a property name into a sentence-case label: {@code createdBy} and {@code created_by}
   * both become {@code "Created by"}.
   */
  public static String humanize(String property) {
    String spaced = property
        .replaceAll("([a-z0-9])([A-Z])", "$1 $2")
        .replace('_', ' ')
        .trim()
        .toLowerCase();
    if (spaced.isEmpty()) {
      return spaced;
    }
    return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
  }

  public static String describe(ConstraintViolation<?> violation) {
    return humanize(violation.getPropertyPath().toString()) + " " + violation.getMessage();
  }

  public static List<String> describeAll(Collection<? extends ConstraintViolation<?>> violations) {
    return violations.stream()
        .map(ValidationMessages::describe)
        .sorted()
        .toList();
  }

  public static String summary(List<String> errors) {
    return PREFIX + String.join(", ", errors);
  }

  public static <T> Outcome<T> failure(List<String> errors) {
    return Outcome.failure(ErrorKind.VALIDATION_FAILED, summary(errors));
  }

  public static <T> Outcome<T> failure(String error) {
    return failure(List.of(error));
  }
}

package com.example.todos.web.rest.errors;

import com.example.todos.exception.ErrorKind;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Fixed status and client message for every {@link ErrorKind}.
 *
 * <p>Kinds that expose detail show the detail supplied with the failure; all other kinds always
 * show their catalog message, whatever detail was attached.
 */
@Component
public class ErrorCatalog {

  public record Entry(HttpStatus status, String message) {}

  private final Map<ErrorKind, Entry> entries = new EnumMap<>(ErrorKind.class);

  public ErrorCatalog() {
    entries.put(ErrorKind.MISSING_TOKEN,
                new Entry(HttpStatus.UNAUTHORIZED, "Missing token"));
    entries.put(ErrorKind.INVALID_TOKEN,
                new Entry(HttpStatus.UNAUTHORIZED, "Invalid token"));
    entries.put(ErrorKind.EXPIRED_TOKEN,
                new Entry(HttpStatus.UNAUTHORIZED,
                          "Sorry, your token has expired. Please login to continue."));
    entries.put(ErrorKind.AUTHENTICATION_FAILED,
                new Entry(HttpStatus.UNAUTHORIZED, "Invalid credentials"));
    entries.put(ErrorKind.VALIDATION_FAILED,
                new Entry(HttpStatus.UNPROCESSABLE_ENTITY, "Validation failed"));
    entries.put(ErrorKind.NOT_FOUND,
                new Entry(HttpStatus.NOT_FOUND, "Not found"));
  }

  public HttpStatus statusOf(ErrorKind kind) {
    return entries.get(kind).status();
  }

  public String messageOf(ErrorKind kind, Optional<String> detail) {
    if (kind.exposesDetail() && detail.isPresent()) {
      return detail.get();
    }
    return entries.get(kind).message();
  }
}

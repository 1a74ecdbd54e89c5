package com.example.todos.domain.entity;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;

/**
 * Verified content of an auth token.
 *
 * @param subject   id of the {@link User} the token was issued to
 * @param expiresAt absolute expiry, always present, held at whole-second precision as in {@code exp}
 * @param extra     any further claims carried by the token
 */
public record TokenClaims(
    long subject,
    Instant expiresAt,
    Map<String, Object> extra
) {

  public TokenClaims {
    expiresAt = Objects.requireNonNull(expiresAt, "expiresAt").truncatedTo(ChronoUnit.SECONDS);
    extra = extra == null ? Map.of() : Map.copyOf(extra);
  }

  public static TokenClaims of(long subject, Instant expiresAt) {
    return new TokenClaims(subject, expiresAt, Map.of());
  }
}

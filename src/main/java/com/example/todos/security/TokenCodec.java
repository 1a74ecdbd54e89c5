package com.example.todos.security;

import com.example.todos.config.JwtCodecConfig;
import com.example.todos.domain.entity.TokenClaims;
import com.example.todos.exception.ErrorKind;
import com.example.todos.exception.Outcome;
import com.example.todos.properties.ApplicationProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimNames;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwtValidationException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Issues and verifies HS256 auth tokens.
 *
 * <p>The user id travels in the {@value #USER_ID_CLAIM} claim. Decoding verifies the signature
 * before expiry, and never hands back claims of a token that failed either check.
 */
@Slf4j
@Component
public class TokenCodec {

  public static final String USER_ID_CLAIM = "user_id";

  private final JwtEncoder jwtEncoder;
  private final JwtDecoder jwtDecoder;
  private final Clock clock;
  private final Duration ttl;

  @Autowired
  public TokenCodec(JwtEncoder jwtEncoder,
                    JwtDecoder jwtDecoder,
                    Clock clock,
                    ApplicationProperties properties) {
    this(jwtEncoder, jwtDecoder, clock, properties.auth().jwt().ttl());
  }

  TokenCodec(JwtEncoder jwtEncoder, JwtDecoder jwtDecoder, Clock clock, Duration ttl) {
    this.jwtEncoder = jwtEncoder;
    this.jwtDecoder = jwtDecoder;
    this.clock = clock;
    this.ttl = ttl;
  }

  /**
   * Signs a token for the given user that expires after the configured ttl.
   */
  public String encode(long subject) {
    return encode(subject, Map.of());
  }

  public String encode(long subject, Map<String, Object> extra) {
    return encode(new TokenClaims(subject, clock.instant().plus(ttl), extra));
  }

  /**
   * Signs exactly the given claims. An expiry in the past is allowed and yields a token that will
   * never decode.
   */
  public String encode(TokenClaims claims) {
    JwtClaimsSet claimsSet = JwtClaimsSet.builder()
        .claims(all -> all.putAll(claims.extra()))
        .claim(USER_ID_CLAIM, claims.subject())
        .expiresAt(claims.expiresAt())
        .build();
    JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();

    return jwtEncoder.encode(JwtEncoderParameters.from(header, claimsSet)).getTokenValue();
  }

  /**
   * Verifies a token and extracts its claims.
   *
   * @return the claims, or {@link ErrorKind#EXPIRED_TOKEN} for a correctly signed token past its
   *     expiry, or {@link ErrorKind#INVALID_TOKEN} for anything else that does not verify
   */
  public Outcome<TokenClaims> decode(String token) {
    if (!StringUtils.hasText(token)) {
      return Outcome.failure(ErrorKind.INVALID_TOKEN);
    }

    Jwt jwt;
    try {
      jwt = jwtDecoder.decode(token);
    } catch (JwtValidationException e) {
      if (isExpiry(e)) {
        log.debug("Rejected expired token");
        return Outcome.failure(ErrorKind.EXPIRED_TOKEN);
      }
      log.debug("Rejected token: {}", e.getMessage());
      return Outcome.failure(ErrorKind.INVALID_TOKEN);
    } catch (JwtException e) {
      log.debug("Rejected token: {}", e.getMessage());
      return Outcome.failure(ErrorKind.INVALID_TOKEN);
    }

    Long subject = subjectOf(jwt);
    if (subject == null) {
      log.debug("Rejected token without a numeric {} claim", USER_ID_CLAIM);
      return Outcome.failure(ErrorKind.INVALID_TOKEN);
    }

    Map<String, Object> extra = new HashMap<>(jwt.getClaims());
    extra.remove(USER_ID_CLAIM);
    extra.remove(JwtClaimNames.EXP);
    return Outcome.success(new TokenClaims(subject, jwt.getExpiresAt(), extra));
  }

  private static boolean isExpiry(JwtValidationException e) {
    return e.getErrors().stream()
        .map(OAuth2Error::getErrorCode)
        .anyMatch(JwtCodecConfig.TOKEN_EXPIRED::equals);
  }

  private static Long subjectOf(Jwt jwt) {
    Object value = jwt.getClaims().get(USER_ID_CLAIM);
    if (value instanceof Number number) {
      return number.longValue();
    }
    if (value instanceof String text) {
      try {
        return Long.parseLong(text.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }
}

package com.example.todos.config;

import com.example.todos.properties.ApplicationProperties;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

/**
 * HS256 signing key plus the encoder and decoder built on it.
 *
 * <p>The decoder's only validator is {@link #expiryValidator(Clock)}: expiry is mandatory and is
 * enforced against the injected clock with no skew allowance.
 */
@Configuration(proxyBeanMethods = false)
public class JwtCodecConfig {

  public static final String TOKEN_EXPIRED = "token_expired";

  static final String HMAC_ALGORITHM = "HmacSHA256";

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public SecretKey tokenSigningKey(ApplicationProperties properties) {
    return signingKey(properties.auth().jwt().secret());
  }

  @Bean
  public JwtEncoder jwtEncoder(SecretKey tokenSigningKey) {
    return new NimbusJwtEncoder(new ImmutableSecret<>(tokenSigningKey));
  }

  @Bean
  public JwtDecoder jwtDecoder(SecretKey tokenSigningKey, Clock clock) {
    NimbusJwtDecoder decoder = NimbusJwtDecoder
        .withSecretKey(tokenSigningKey)
        .macAlgorithm(MacAlgorithm.HS256)
        .build();

    decoder.setJwtValidator(expiryValidator(clock));

    return decoder;
  }

  public static SecretKey signingKey(String secret) {
    return new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
  }

  /**
   * Rejects tokens without {@code exp} as invalid, and tokens whose {@code exp} is not strictly in
   * the future with the {@value #TOKEN_EXPIRED} error code.
   */
  public static OAuth2TokenValidator<Jwt> expiryValidator(Clock clock) {
    return jwt -> {
      Instant expiresAt = jwt.getExpiresAt();
      if (expiresAt == null) {
        return OAuth2TokenValidatorResult.failure(
            new OAuth2Error(OAuth2ErrorCodes.INVALID_TOKEN, "Missing exp claim", null));
      }
      return clock.instant().isBefore(expiresAt)
          ? OAuth2TokenValidatorResult.success()
          : OAuth2TokenValidatorResult.failure(new OAuth2Error(TOKEN_EXPIRED, "Token expired", null));
    };
  }
}

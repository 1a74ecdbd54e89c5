package com.example.todos.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.todos.config.JwtCodecConfig;
import com.example.todos.domain.entity.TokenClaims;
import com.example.todos.exception.ErrorKind;
import com.example.todos.exception.Outcome;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import javax.crypto.SecretKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;

@Tag("unit")
class TokenCodecTest {

  private static final String SECRET = "test-secret-key-for-jwt-testing-32chars-long";
  private static final String OTHER_SECRET = "another-secret-key-for-jwt-testing-32chars";
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
  private static final Duration TTL = Duration.ofHours(24);

  private final JwtCodecConfig config = new JwtCodecConfig();
  private SecretKey key;
  private JwtEncoder encoder;
  private TokenCodec codec;

  @BeforeEach
  void setUp() {
    key = JwtCodecConfig.signingKey(SECRET);
    encoder = config.jwtEncoder(key);
    codec = codecAt(NOW);
  }

  private TokenCodec codecAt(Instant instant) {
    Clock clock = Clock.fixed(instant, ZoneOffset.UTC);
    return new TokenCodec(encoder, config.jwtDecoder(key, clock), clock, TTL);
  }

  @Nested
  @DisplayName("encode")
  class Encode {

    @Test
    @DisplayName("default expiry is now plus the configured ttl")
    void defaultExpiry() {
      // when
      String token = codec.encode(42L);

      // then
      Outcome<TokenClaims> decoded = codec.decode(token);
      assertThat(decoded.isSuccess()).isTrue();
      assertThat(decoded.getValue().subject()).isEqualTo(42L);
      assertThat(decoded.getValue().expiresAt()).isEqualTo(NOW.plus(TTL));
    }

    @Test
    @DisplayName("a clock between seconds yields the expiry the claims were built with")
    void subSecondClock() {
      // given
      Instant between = NOW.plusMillis(750);
      TokenCodec codecBetween = codecAt(between);

      // when
      TokenClaims decoded = codecBetween.decode(codecBetween.encode(1L)).getValue();

      // then
      assertThat(decoded.expiresAt()).isEqualTo(NOW.plus(TTL));
      assertThat(decoded.expiresAt())
          .isEqualTo(TokenClaims.of(1L, between.plus(TTL)).expiresAt());
    }

    @Test
    @DisplayName("claims with a sub-second expiry decode back equal to themselves")
    void subSecondClaims() {
      // given
      TokenClaims claims = new TokenClaims(3L, NOW.plusSeconds(90).plusNanos(123_456_789),
                                           Map.of("tenant", "todos"));

      // when
      TokenClaims decoded = codec.decode(codec.encode(claims)).getValue();

      // then
      assertThat(claims.expiresAt()).isEqualTo(NOW.plusSeconds(90));
      assertThat(decoded).isEqualTo(claims);
    }

    @Test
    @DisplayName("produces a three part compact JWS")
    void compactForm() {
      assertThat(codec.encode(1L).split("\\.")).hasSize(3);
    }

    @Test
    @DisplayName("extra claims survive and reserved claims are not repeated in extra")
    void extraClaims() {
      // when
      String token = codec.encode(7L, Map.of("role", "admin"));

      // then
      TokenClaims claims = codec.decode(token).getValue();
      assertThat(claims.extra()).containsEntry("role", "admin");
      assertThat(claims.extra()).doesNotContainKeys(TokenCodec.USER_ID_CLAIM, "exp");
    }
  }

  @Nested
  @DisplayName("decode")
  class Decode {

    @Test
    @DisplayName("a token is expired from its exp second onwards")
    void expiredAtExactExpiry() {
      // given
      String token = codec.encode(TokenClaims.of(5L, NOW.plusSeconds(60)));

      // then
      assertThat(codecAt(NOW.plusSeconds(59)).decode(token).isSuccess()).isTrue();
      assertThat(codecAt(NOW.plusSeconds(60)).decode(token).getErrorKind())
          .isEqualTo(ErrorKind.EXPIRED_TOKEN);
    }

    @Test
    @DisplayName("a token encoded with a past expiry never decodes")
    void alreadyExpired() {
      // given
      String token = codec.encode(TokenClaims.of(5L, NOW.minusSeconds(1)));

      // then
      assertThat(codec.decode(token).getErrorKind()).isEqualTo(ErrorKind.EXPIRED_TOKEN);
    }

    @Test
    @DisplayName("a token signed with another secret is invalid")
    void foreignSignature() {
      // given
      JwtEncoder foreign = config.jwtEncoder(JwtCodecConfig.signingKey(OTHER_SECRET));
      String token = new TokenCodec(foreign, config.jwtDecoder(key, Clock.systemUTC()),
                                    Clock.fixed(NOW, ZoneOffset.UTC), TTL).encode(5L);

      // then
      assertThat(codec.decode(token).getErrorKind()).isEqualTo(ErrorKind.INVALID_TOKEN);
    }

    @Test
    @DisplayName("signature is checked before expiry")
    void expiredForeignTokenIsInvalid() {
      // given
      JwtEncoder foreign = config.jwtEncoder(JwtCodecConfig.signingKey(OTHER_SECRET));
      String token = new TokenCodec(foreign, config.jwtDecoder(key, Clock.systemUTC()),
                                    Clock.fixed(NOW, ZoneOffset.UTC), TTL)
          .encode(TokenClaims.of(5L, NOW.minusSeconds(3600)));

      // then
      assertThat(codec.decode(token).getErrorKind()).isEqualTo(ErrorKind.INVALID_TOKEN);
    }

    @Test
    @DisplayName("a tampered payload is invalid")
    void tamperedPayload() {
      // given
      String[] parts = codec.encode(5L).split("\\.");
      String other = codec.encode(6L).split("\\.")[1];
      String tampered = parts[0] + "." + other + "." + parts[2];

      // then
      assertThat(codec.decode(tampered).getErrorKind()).isEqualTo(ErrorKind.INVALID_TOKEN);
    }

    @Test
    @DisplayName("malformed and blank input is invalid")
    void malformed() {
      assertThat(codec.decode("not-a-token").getErrorKind()).isEqualTo(ErrorKind.INVALID_TOKEN);
      assertThat(codec.decode("a.b.c").getErrorKind()).isEqualTo(ErrorKind.INVALID_TOKEN);
      assertThat(codec.decode("").getErrorKind()).isEqualTo(ErrorKind.INVALID_TOKEN);
      assertThat(codec.decode(null).getErrorKind()).isEqualTo(ErrorKind.INVALID_TOKEN);
    }

    @Test
    @DisplayName("a token without user_id is invalid")
    void missingSubject() {
      // given
      String token = sign(JwtClaimsSet.builder()
                              .claim("role", "admin")
                              .expiresAt(NOW.plusSeconds(60))
                              .build());

      // then
      assertThat(codec.decode(token).getErrorKind()).isEqualTo(ErrorKind.INVALID_TOKEN);
    }

    @Test
    @DisplayName("a token with a non-numeric user_id is invalid")
    void nonNumericSubject() {
      // given
      String token = sign(JwtClaimsSet.builder()
                              .claim(TokenCodec.USER_ID_CLAIM, "abc")
                              .expiresAt(NOW.plusSeconds(60))
                              .build());

      // then
      assertThat(codec.decode(token).getErrorKind()).isEqualTo(ErrorKind.INVALID_TOKEN);
    }

    @Test
    @DisplayName("a numeric string user_id is accepted")
    void numericStringSubject() {
      // given
      String token = sign(JwtClaimsSet.builder()
                              .claim(TokenCodec.USER_ID_CLAIM, "12")
                              .expiresAt(NOW.plusSeconds(60))
                              .build());

      // then
      assertThat(codec.decode(token).getValue().subject()).isEqualTo(12L);
    }

    @Test
    @DisplayName("a token without exp is invalid")
    void missingExpiry() {
      // given
      String token = sign(JwtClaimsSet.builder().claim(TokenCodec.USER_ID_CLAIM, 5L).build());

      // then
      assertThat(codec.decode(token).getErrorKind()).isEqualTo(ErrorKind.INVALID_TOKEN);
    }

    private String sign(JwtClaimsSet claims) {
      JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
      return encoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
    }
  }
}

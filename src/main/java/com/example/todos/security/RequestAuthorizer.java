package com.example.todos.security;

import com.example.todos.domain.entity.UserPrincipal;
import com.example.todos.exception.ErrorKind;
import com.example.todos.exception.Outcome;
import com.example.todos.repository.UserRepository;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves the {@code Authorization} header of a request to the user it was issued for.
 *
 * <p>The header's last whitespace-separated segment is taken as the token, so both
 * {@code Bearer <token>} and a bare token are accepted. A token that verifies but names a user who
 * no longer exists is rejected as {@link ErrorKind#INVALID_TOKEN}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestAuthorizer {

  static final String PRINCIPAL_ATTRIBUTE = RequestAuthorizer.class.getName() + ".OUTCOME";

  private final TokenCodec tokenCodec;
  private final UserRepository userRepository;

  /**
   * Authorizes the request, resolving it at most once. Later calls for the same request return the
   * first outcome without touching the token or the user store again.
   */
  @SuppressWarnings("unchecked")
  public Outcome<UserPrincipal> authorize(HttpServletRequest request) {
    Object memoized = request.getAttribute(PRINCIPAL_ATTRIBUTE);
    if (memoized instanceof Outcome<?> outcome) {
      return (Outcome<UserPrincipal>) outcome;
    }
    Outcome<UserPrincipal> outcome = authorize(request.getHeader(HttpHeaders.AUTHORIZATION));
    request.setAttribute(PRINCIPAL_ATTRIBUTE, outcome);
    return outcome;
  }

  public Outcome<UserPrincipal> authorize(String authorizationHeader) {
    if (!StringUtils.hasText(authorizationHeader)) {
      return Outcome.failure(ErrorKind.MISSING_TOKEN);
    }

    String[] segments = authorizationHeader.trim().split("\\s+");
    String token = segments[segments.length - 1];

    return tokenCodec.decode(token).flatMap(claims -> resolve(claims.subject()));
  }

  private Outcome<UserPrincipal> resolve(long userId) {
    return userRepository.findById(userId)
        .map(user -> Outcome.success(UserPrincipal.from(user)))
        .orElseGet(() -> {
          log.debug("Token subject {} no longer exists", userId);
          return Outcome.failure(ErrorKind.INVALID_TOKEN);
        });
  }
}

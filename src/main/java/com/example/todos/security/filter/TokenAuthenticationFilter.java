package com.example.todos.security.filter;

import com.example.todos.domain.entity.UserPrincipal;
import com.example.todos.exception.ApiException;
import com.example.todos.exception.Outcome;
import com.example.todos.security.RequestAuthorizer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerExceptionResolver;

/**
 * Authenticates protected requests from their bearer token.
 *
 * <p>On success the {@link UserPrincipal} becomes the request's authentication. On failure the
 * chain stops and the failure is rendered by the MVC exception resolver, so clients get the same
 * error body a controller would produce.
 */
@Slf4j
@RequiredArgsConstructor
public class TokenAuthenticationFilter extends OncePerRequestFilter {

  private final RequestAuthorizer requestAuthorizer;
  private final HandlerExceptionResolver handlerExceptionResolver;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    Outcome<UserPrincipal> outcome = requestAuthorizer.authorize(request);

    if (outcome.isFailure()) {
      log.debug("TokenAuthenticationFilter: {} {} rejected with {}",
                request.getMethod(), request.getRequestURI(), outcome.getErrorKind());
      handlerExceptionResolver.resolveException(
          request, response, null, new ApiException(outcome.getErrorKind()));
      return;
    }

    UserPrincipal principal = outcome.getValue();
    SecurityContext context = SecurityContextHolder.createEmptyContext();
    context.setAuthentication(
        UsernamePasswordAuthenticationToken.authenticated(principal, null, List.of()));
    SecurityContextHolder.setContext(context);
    log.trace("TokenAuthenticationFilter: authenticated user {}", principal.id());

    filterChain.doFilter(request, response);
  }
}

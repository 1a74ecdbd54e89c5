package com.example.todos.web.rest.errors;

import com.example.todos.exception.ApiException;
import com.example.todos.exception.ErrorKind;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerExceptionResolver;

/**
 * Renders unauthenticated access to a protected endpoint as a missing-token error.
 *
 * Instead of Spring Security's default HTML or empty 401, the failure goes through
 * {@link GlobalErrorHandler} so clients always receive the JSON error body.
 */
@Component
public class DelegatedAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private final HandlerExceptionResolver resolver;

  public DelegatedAuthenticationEntryPoint(
      @Qualifier("handlerExceptionResolver") HandlerExceptionResolver resolver) {
    this.resolver = resolver;
  }

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response,
                       AuthenticationException authException) {
    resolver.resolveException(request, response, null, new ApiException(ErrorKind.MISSING_TOKEN));
  }
}

package com.example.todos.web.versioning;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Collection;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.mvc.condition.AbstractRequestCondition;

/**
 * Request condition that holds only when the route's dispatcher selects this condition's version.
 * Exactly one version of a route therefore matches any given request.
 */
public final class ApiVersionRequestCondition
    extends AbstractRequestCondition<ApiVersionRequestCondition> {

  private final String route;
  private final String label;
  private final ApiVersionRouting routing;

  public ApiVersionRequestCondition(String route, String label, ApiVersionRouting routing) {
    this.route = route;
    this.label = label;
    this.routing = routing;
  }

  @Override
  protected Collection<String> getContent() {
    return List.of(label);
  }

  @Override
  protected String getToStringInfix() {
    return " || ";
  }

  @Override
  public ApiVersionRequestCondition combine(ApiVersionRequestCondition other) {
    return other;
  }

  @Override
  public ApiVersionRequestCondition getMatchingCondition(HttpServletRequest request) {
    if (CorsUtils.isPreFlightRequest(request)) {
      return this;
    }
    String selected = routing.select(route, request.getHeader(HttpHeaders.ACCEPT));
    return label.equals(selected) ? this : null;
  }

  @Override
  public int compareTo(ApiVersionRequestCondition other, HttpServletRequest request) {
    return 0;
  }
}

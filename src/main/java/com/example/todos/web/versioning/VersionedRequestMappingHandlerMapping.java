package com.example.todos.web.versioning;

import java.lang.reflect.Method;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.web.servlet.mvc.method.RequestMappingInfo;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

/**
 * Request mapping that attaches an {@link ApiVersionRequestCondition} to handlers of
 * {@link ApiVersionMapping @ApiVersionMapping} controllers and seals the version routing table once
 * every handler is registered.
 */
@Slf4j
public class VersionedRequestMappingHandlerMapping extends RequestMappingHandlerMapping {

  private final ApiVersionRouting routing;

  public VersionedRequestMappingHandlerMapping(ApiVersionRouting routing) {
    this.routing = routing;
  }

  @Override
  protected RequestMappingInfo getMappingForMethod(Method method, Class<?> handlerType) {
    RequestMappingInfo info = super.getMappingForMethod(method, handlerType);
    if (info == null) {
      return null;
    }
    ApiVersionMapping versionMapping =
        AnnotatedElementUtils.findMergedAnnotation(handlerType, ApiVersionMapping.class);
    if (versionMapping == null) {
      return info;
    }

    String route = routeOf(info);
    routing.declare(route, versionMapping.value());
    log.debug("Mapped {} {} to version {}", route, method.getName(), versionMapping.value());
    return info.addCustomCondition(
        new ApiVersionRequestCondition(route, versionMapping.value(), routing));
  }

  @Override
  public void afterPropertiesSet() {
    super.afterPropertiesSet();
    routing.seal();
  }

  /**
   * Route identity shared by every version of the same endpoint: HTTP methods plus path patterns.
   */
  static String routeOf(RequestMappingInfo info) {
    Set<String> methods = info.getMethodsCondition().getMethods().stream()
        .map(Enum::name)
        .collect(Collectors.toCollection(TreeSet::new));
    Set<String> patterns = new TreeSet<>(info.getPatternValues());
    return (methods.isEmpty() ? "ANY" : String.join(",", methods)) + " " + String.join(",", patterns);
  }
}

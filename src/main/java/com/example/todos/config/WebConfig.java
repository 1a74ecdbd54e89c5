package com.example.todos.config;

import com.example.todos.properties.ApplicationProperties;
import com.example.todos.web.versioning.ApiVersionRouting;
import com.example.todos.web.versioning.VersionMatcher;
import com.example.todos.web.versioning.VersionedRequestMappingHandlerMapping;
import org.springframework.boot.autoconfigure.web.servlet.WebMvcRegistrations;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

/**
 * Accept-header version negotiation wiring.
 * Replaces Spring MVC's request mapping with one that understands {@code @ApiVersionMapping}.
 */
@Configuration(proxyBeanMethods = false)
public class WebConfig {

  @Bean
  public VersionMatcher versionMatcher(ApplicationProperties properties) {
    return new VersionMatcher(properties.api().vendor());
  }

  @Bean
  public ApiVersionRouting apiVersionRouting(VersionMatcher versionMatcher,
                                             ApplicationProperties properties) {
    return new ApiVersionRouting(versionMatcher, properties.api().declaredVersions());
  }

  @Bean
  public WebMvcRegistrations versionedMvcRegistrations(ApiVersionRouting apiVersionRouting) {
    return new WebMvcRegistrations() {
      @Override
      public RequestMappingHandlerMapping getRequestMappingHandlerMapping() {
        return new VersionedRequestMappingHandlerMapping(apiVersionRouting);
      }
    };
  }
}

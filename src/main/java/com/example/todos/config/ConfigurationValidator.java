package com.example.todos.config;

import com.example.todos.properties.ApplicationProperties;
import com.example.todos.web.versioning.VersionedDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Enforces configuration rules that bean validation on {@link ApplicationProperties} cannot
 * express. Fails startup listing every violation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_MIN_DURATION = "%s must be at least %s.";
  private static final String DEFAULT_SECRET_PREFIX = "dev-secret";
  private static final String PRODUCTION_PROFILE = "prod";
  private static final int MIN_SECRET_BYTES = 32;
  private static final int MAX_PAGE_SIZE = 100;

  private final ApplicationProperties properties;
  private final Environment environment;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = validate();

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  List<String> validate() {
    List<String> errors = new ArrayList<>();
    validateAuthConfig(errors);
    validateApiConfig(errors);
    validatePaginationConfig(errors);
    return errors;
  }

  private void validateAuthConfig(List<String> errors) {
    ApplicationProperties.AuthProperties.JwtProperties jwt = properties.auth().jwt();

    if (jwt.secret().getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      errors.add("JWT secret must be at least %d bytes for HS256.".formatted(MIN_SECRET_BYTES));
    }
    if (environment.acceptsProfiles(Profiles.of(PRODUCTION_PROFILE))
        && jwt.secret().startsWith(DEFAULT_SECRET_PREFIX)) {
      errors.add("JWT_SECRET must be set in production; the development secret is not allowed.");
    }
    if (jwt.ttl().compareTo(Duration.ofMinutes(1)) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("JWT ttl", "1 minute"));
    }
  }

  private void validateApiConfig(List<String> errors) {
    try {
      VersionedDispatcher.validateOrder("app.api.versions", properties.api().declaredVersions());
    } catch (IllegalStateException e) {
      errors.add(e.getMessage());
    }
  }

  private void validatePaginationConfig(List<String> errors) {
    int pageSize = properties.pagination().pageSize();
    if (pageSize > MAX_PAGE_SIZE) {
      errors.add("Page size must be at most %d, but was: %d".formatted(MAX_PAGE_SIZE, pageSize));
    }
  }
}

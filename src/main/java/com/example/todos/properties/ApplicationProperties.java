package com.example.todos.properties;

import com.example.todos.web.versioning.ApiVersion;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Centralized configuration properties for the Todos API.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid AuthProperties auth,
    @NotNull @Valid ApiProperties api,
    @NotNull @Valid PaginationProperties pagination
) {

  /**
   * Token issuance configuration
   */
  public record AuthProperties(@NotNull @Valid JwtProperties jwt) {
    public record JwtProperties(
        @NotBlank String secret,
        @DefaultValue("24h") @NotNull Duration ttl
    ) {}
  }

  /**
   * Content negotiation configuration.
   * Versions are evaluated in declaration order; the default one goes last.
   */
  public record ApiProperties(
      @DefaultValue("todos") @NotBlank @Pattern(regexp = "[a-z0-9.-]+") String vendor,
      @NotEmpty List<@Valid VersionProperties> versions
  ) {
    public record VersionProperties(
        @NotBlank String label,
        @DefaultValue("false") boolean isDefault
    ) {}

    public List<ApiVersion> declaredVersions() {
      return versions.stream()
          .map(version -> new ApiVersion(version.label(), version.isDefault()))
          .toList();
    }
  }

  /**
   * List endpoints page size
   */
  public record PaginationProperties(
      @DefaultValue("20") @Positive int pageSize
  ) {}
}

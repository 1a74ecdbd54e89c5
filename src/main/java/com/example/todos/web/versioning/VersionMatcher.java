package com.example.todos.web.versioning;

import org.springframework.util.Assert;

/**
 * Decides whether a request's {@code Accept} header selects a version.
 *
 * <p>The header matches when it contains {@code application/vnd.<vendor>.<label>+json}. A header
 * that is absent or names something else falls through to the version's default flag.
 */
public class VersionMatcher {

  private static final String MEDIA_TYPE_TEMPLATE = "application/vnd.%s.%s+json";

  private final String vendor;

  public VersionMatcher(String vendor) {
    Assert.hasText(vendor, "vendor must not be blank");
    this.vendor = vendor;
  }

  public boolean matches(String acceptHeader, ApiVersion version) {
    return matchesExplicitly(acceptHeader, version) || version.isDefault();
  }

  public boolean matchesExplicitly(String acceptHeader, ApiVersion version) {
    return acceptHeader != null && acceptHeader.contains(mediaType(version.label()));
  }

  public String mediaType(String label) {
    return MEDIA_TYPE_TEMPLATE.formatted(vendor, label);
  }
}

package com.example.todos.web.versioning;

import org.springframework.util.Assert;

/**
 * A declared API version, e.g. {@code v1}. The default version serves requests whose
 * {@code Accept} header names no registered version.
 */
public record ApiVersion(String label, boolean isDefault) {

  public ApiVersion {
    Assert.hasText(label, "version label must not be blank");
  }

  public static ApiVersion of(String label) {
    return new ApiVersion(label, false);
  }

  public static ApiVersion defaultVersion(String label) {
    return new ApiVersion(label, true);
  }
}

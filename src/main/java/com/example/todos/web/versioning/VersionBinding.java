package com.example.todos.web.versioning;

import java.util.Objects;

/**
 * Pairs a declared version with whatever serves it.
 */
public record VersionBinding<H>(ApiVersion version, H handler) {

  public VersionBinding {
    Objects.requireNonNull(version, "version");
    Objects.requireNonNull(handler, "handler");
  }
}

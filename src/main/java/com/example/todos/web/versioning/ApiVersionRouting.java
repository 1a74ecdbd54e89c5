package com.example.todos.web.versioning;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-route version table.
 *
 * <p>While handler mappings are being registered, each versioned handler method declares the
 * route it serves and its version label. {@link #seal()} then builds one {@link VersionedDispatcher}
 * per route, ordering that route's versions as they are configured globally. After sealing the
 * table is read-only and is consulted on every request.
 */
@Slf4j
public class ApiVersionRouting {

  private final VersionMatcher matcher;
  private final List<ApiVersion> declaredVersions;
  private final Map<String, ApiVersion> versionsByLabel;
  private final Map<String, Set<String>> labelsByRoute = new LinkedHashMap<>();

  private volatile Map<String, VersionedDispatcher<String>> dispatchers;

  public ApiVersionRouting(VersionMatcher matcher, List<ApiVersion> declaredVersions) {
    VersionedDispatcher.validateOrder("app.api.versions", declaredVersions);
    this.matcher = matcher;
    this.declaredVersions = List.copyOf(declaredVersions);
    this.versionsByLabel = this.declaredVersions.stream()
        .collect(Collectors.toUnmodifiableMap(ApiVersion::label, version -> version));
  }

  /**
   * Records that the given route has a handler for the given version.
   *
   * @throws IllegalStateException if the label is not configured or the table is already sealed
   */
  public synchronized void declare(String route, String label) {
    if (dispatchers != null) {
      throw new IllegalStateException("Version routing is sealed; cannot add " + label + " " + route);
    }
    if (!versionsByLabel.containsKey(label)) {
      throw new IllegalStateException(
          "Handler for %s declares version '%s' which is not one of %s"
              .formatted(route, label, versionsByLabel.keySet()));
    }
    labelsByRoute.computeIfAbsent(route, key -> new LinkedHashSet<>()).add(label);
  }

  /**
   * Builds and validates every route's dispatcher. Fails if a route lacks exactly one default.
   */
  public synchronized void seal() {
    if (dispatchers != null) {
      return;
    }
    Map<String, VersionedDispatcher<String>> built = new LinkedHashMap<>();
    labelsByRoute.forEach((route, labels) -> {
      List<VersionBinding<String>> bindings = declaredVersions.stream()
          .filter(version -> labels.contains(version.label()))
          .map(version -> new VersionBinding<>(version, version.label()))
          .toList();
      built.put(route, new VersionedDispatcher<>(route, matcher, bindings));
    });
    dispatchers = Map.copyOf(built);
    log.info("Sealed API version routing: {} versioned route(s), versions {}",
             built.size(), declaredVersions.stream().map(ApiVersion::label).toList());
  }

  /**
   * Returns the version label that serves the given route for the given {@code Accept} header.
   */
  public String select(String route, String acceptHeader) {
    Map<String, VersionedDispatcher<String>> current = dispatchers;
    if (current == null) {
      throw new IllegalStateException("Version routing has not been sealed");
    }
    VersionedDispatcher<String> dispatcher = current.get(route);
    if (dispatcher == null) {
      throw new IllegalStateException("No versioned handlers registered for " + route);
    }
    return dispatcher.dispatch(acceptHeader);
  }

  public boolean isSealed() {
    return dispatchers != null;
  }
}

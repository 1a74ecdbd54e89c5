package com.example.todos.web.versioning;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, first-match-wins selection among the versions that serve one route.
 *
 * <p>Bindings are walked in declaration order and the first one whose version matches the
 * request's {@code Accept} header wins. Because the default version matches every request, it
 * must be the single default and it must come last; both rules are enforced at construction so a
 * misordered table fails at startup instead of silently shadowing newer versions.
 *
 * @param <H> what a binding resolves to
 */
public final class VersionedDispatcher<H> {

  private final String route;
  private final VersionMatcher matcher;
  private final List<VersionBinding<H>> bindings;

  public VersionedDispatcher(String route, VersionMatcher matcher, List<VersionBinding<H>> bindings) {
    this.route = route;
    this.matcher = matcher;
    this.bindings = List.copyOf(bindings);
    validateOrder(route, this.bindings.stream().map(VersionBinding::version).toList());
  }

  /**
   * Returns the handler of the first binding that matches the given {@code Accept} header.
   */
  public H dispatch(String acceptHeader) {
    for (VersionBinding<H> binding : bindings) {
      if (matcher.matches(acceptHeader, binding.version())) {
        return binding.handler();
      }
    }
    // unreachable once validated: the trailing default always matches
    throw new IllegalStateException("No version of route " + route + " accepts the request");
  }

  public List<VersionBinding<H>> bindings() {
    return bindings;
  }

  /**
   * Checks that versions are unique, that exactly one of them is the default and that the default
   * is declared after every non-default version.
   *
   * @throws IllegalStateException describing every violation found
   */
  public static void validateOrder(String route, List<ApiVersion> versions) {
    List<String> errors = new ArrayList<>();
    if (versions.isEmpty()) {
      errors.add("no versions declared");
    }

    Set<String> seen = new HashSet<>();
    int defaults = 0;
    ApiVersion firstDefault = null;
    for (ApiVersion version : versions) {
      if (!seen.add(version.label())) {
        errors.add("version '%s' declared more than once".formatted(version.label()));
      }
      if (version.isDefault()) {
        defaults++;
        if (firstDefault == null) {
          firstDefault = version;
        }
      } else if (firstDefault != null) {
        errors.add("default version '%s' is declared before non-default version '%s'"
                       .formatted(firstDefault.label(), version.label()));
      }
    }
    if (!versions.isEmpty() && defaults != 1) {
      errors.add("exactly one default version is required but found %d".formatted(defaults));
    }

    if (!errors.isEmpty()) {
      throw new IllegalStateException("Invalid API version bindings for %s: %s"
                                          .formatted(route, String.join("; ", errors)));
    }
  }
}

package com.example.todos.domain.entity;

/**
 * User Principal - the authenticated actor of a single request
 */
public record UserPrincipal(
    Long id,
    String name,
    String email
) {

  public static UserPrincipal from(User user) {
    return new UserPrincipal(user.getId(), user.getName(), user.getEmail());
  }

  /**
   * Value stored in {@code todos.created_by} for records this principal owns.
   */
  public String ownerKey() {
    return String.valueOf(id);
  }
}

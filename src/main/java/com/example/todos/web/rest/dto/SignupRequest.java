package com.example.todos.web.rest.dto;

/**
 * Signup form. {@code password_confirmation} is optional.
 */
public record SignupRequest(
    String name,
    String email,
    String password,
    String passwordConfirmation
) {

  @Override
  public String toString() {
    return "SignupRequest[name=" + name + ", email=" + email + "]";
  }
}

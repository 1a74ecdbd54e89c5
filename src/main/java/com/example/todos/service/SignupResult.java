package com.example.todos.service;

import com.example.todos.domain.entity.User;

/**
 * A newly created account together with the token it was logged in with.
 */
public record SignupResult(User user, String authToken) {}
